package com.sheetdoc.app.formula;

import com.sheetdoc.app.models.PageReference;
import com.sheetdoc.app.models.SheetData;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyCollectorTest {

    @Test
    void testCollectIsSortedAndDistinct() {
        List<String> dependencies = DependencyCollector.collect(FormulaParser.parse("B2+A1+SUM(A1:A3)"));
        assertEquals(Arrays.asList("A1", "A2", "A3", "B2"), dependencies);
    }

    @Test
    void testExternalKeysUseCanonicalMention() {
        List<String> dependencies = DependencyCollector.collect(FormulaParser.parse("@[Budget](p1):b2 + C1"));
        assertEquals(Arrays.asList("@[Budget](p1):B2", "C1"), dependencies);
    }

    @Test
    void testLiteralsHaveNoDependencies() {
        assertTrue(DependencyCollector.collect(FormulaParser.parse("1+\"a\"&TRUE")).isEmpty());
    }

    @Test
    void testOversizedRangeIsRejected() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                () -> DependencyCollector.collect(FormulaParser.parse("SUM(A1:C3)"), 8));
        assertEquals(FormulaErrorCode.RANGE_TOO_LARGE, e.getCode());
        assertEquals("Range A1:C3 covers 9 cells; the limit is 8", e.getMessage());

        assertEquals(9, DependencyCollector.collect(FormulaParser.parse("SUM(A1:C3)"), 9).size());
        assertThrows(FormulaSyntaxException.class,
                () -> DependencyCollector.collect(FormulaParser.parse("@[Budget]:A1:B5"), 8));
    }

    /**
     * Unparseable formulas and plain values are skipped.
     */
    @Test
    void testCollectExternalReferences() {
        SheetData sheet = SheetData.createEmpty(3, 3);
        sheet.setCell("A1", "=@[Budget](1):A1+@[Budget](1):B1");
        sheet.setCell("A2", "=@[Notes]:C3");
        sheet.setCell("A3", "=@[Broken");
        sheet.setCell("B1", "@[NotAFormula]:A1");
        sheet.setCell("C1", "=SUM(@[Huge]:A1:A1000000)");

        List<PageReference> pages = DependencyCollector.collectExternalReferences(sheet);

        assertEquals(2, pages.size());
        assertEquals("@[Budget](1)", pages.get(0).getRaw());
        assertEquals("@[Notes]", pages.get(1).getRaw());
    }
}
