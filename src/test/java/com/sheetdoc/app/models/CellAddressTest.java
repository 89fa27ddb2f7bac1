package com.sheetdoc.app.models;

import com.sheetdoc.app.exceptions.InvalidCellAddressException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    @Test
    void testEncode() {
        assertEquals("A1", CellAddress.encode(0, 0));
        assertEquals("B5", CellAddress.encode(4, 1));
        assertEquals("Z1", CellAddress.encode(0, 25));
        assertEquals("AA1", CellAddress.encode(0, 26));
        assertEquals("AZ3", CellAddress.encode(2, 51));
        assertEquals("BA1", CellAddress.encode(0, 52));
    }

    @Test
    void testDecodeIsCaseInsensitive() {
        CellAddress address = CellAddress.decode(" b5 ");
        assertEquals(4, address.getRow());
        assertEquals(1, address.getColumn());
        assertEquals(new CellAddress(0, 26), CellAddress.decode("AA1"));
    }

    /**
     * Every column up to a few thousand survives encode then decode.
     */
    @Test
    void testColumnLettersHaveNoZeroDigit() {
        for (int column = 0; column < 2000; column++) {
            String encoded = CellAddress.encode(7, column);
            assertEquals(column, CellAddress.decode(encoded).getColumn(), encoded);
        }
    }

    @Test
    void testDecodeRejectsMalformedAddresses() {
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.decode("1A"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.decode("A0"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.decode("A"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.decode(""));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.decode(null));
    }

    @Test
    void testNegativeIndicesRejected() {
        assertThrows(IllegalArgumentException.class, () -> CellAddress.encode(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new CellAddress(0, -1));
    }

    @Test
    void testNormalize() {
        assertEquals("C7", CellAddress.normalize(" c7"));
        assertNull(CellAddress.normalize("C-7"));
        assertFalse(CellAddress.isValid("hello"));
        assertTrue(CellAddress.isValid("zz10"));
    }

    /**
     * Corners may come in any order; the expansion is always row-major.
     */
    @Test
    void testExpandRange() {
        assertEquals(Arrays.asList("A1", "B1", "A2", "B2"), CellAddress.expandRange("A1", "B2"));
        assertEquals(Arrays.asList("A1", "B1", "A2", "B2"), CellAddress.expandRange("B2", "A1"));
        assertEquals(Collections.singletonList("C3"), CellAddress.expandRange("C3", "C3"));
    }

    @Test
    void testRangeSize() {
        assertEquals(4L, CellAddress.rangeSize("B2", "A1"));
        assertEquals(1L, CellAddress.rangeSize("C3", "C3"));
        assertEquals(1000000000L, CellAddress.rangeSize("A1", "A1000000000"));
    }

    @Test
    void testRowMustFitAnInt() {
        assertEquals(2147483645, CellAddress.decode("A2147483646").getRow());
        assertEquals("A2147483647", CellAddress.decode("A2147483647").toString());
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.decode("A2147483648"));
    }

    @Test
    void testOrdering() {
        assertTrue(CellAddress.decode("B1").compareTo(CellAddress.decode("A2")) < 0);
        assertTrue(CellAddress.decode("A2").compareTo(CellAddress.decode("B2")) < 0);
        assertEquals("B5", new CellAddress(4, 1).toString());
    }
}
