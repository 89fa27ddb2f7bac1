package com.sheetdoc.app.models;

import com.sheetdoc.app.exceptions.InvalidCellAddressException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class SheetDataTest {

    @Test
    void testUpdatesReturnNewSheet() {
        SheetData sheet = SheetData.createEmpty(2, 2);
        SheetData updated = sheet.withCellUpdates(Collections.singletonList(new CellUpdate("a1", "5")));

        assertEquals("5", updated.getCell("A1"));
        assertEquals("", sheet.getCell("A1"));
    }

    /**
     * Updates beyond the grid grow it; blank values remove the cell.
     */
    @Test
    void testUpdatesGrowGridAndClearCells() {
        SheetData sheet = SheetData.createEmpty(2, 2).withCellUpdates(Arrays.asList(
                new CellUpdate("A1", "x"),
                new CellUpdate("D7", "y")));
        assertEquals(7, sheet.getRowCount());
        assertEquals(4, sheet.getColumnCount());

        SheetData cleared = sheet.withCellUpdates(Collections.singletonList(new CellUpdate("A1", "   ")));
        assertFalse(cleared.getCells().containsKey("A1"));
        assertEquals("y", cleared.getCell("D7"));
    }

    @Test
    void testInvalidAddressRejectsWholeBatch() {
        SheetData sheet = SheetData.createEmpty(2, 2);
        assertThrows(InvalidCellAddressException.class, () -> sheet.withCellUpdates(Arrays.asList(
                new CellUpdate("A1", "1"),
                new CellUpdate("1A", "2"))));
        assertTrue(sheet.getCells().isEmpty());
    }

    @Test
    void testDimensionsAreAtLeastOne() {
        SheetData sheet = SheetData.createEmpty(0, -3);
        assertEquals(1, sheet.getRowCount());
        assertEquals(1, sheet.getColumnCount());
    }
}
