package com.sheetdoc.app.evaluation.functions;

import com.sheetdoc.app.evaluation.EvalErrorCode;
import com.sheetdoc.app.evaluation.EvaluatedCell;
import com.sheetdoc.app.evaluation.EvaluationOptions;
import com.sheetdoc.app.evaluation.Result;
import com.sheetdoc.app.evaluation.SheetEvaluator;
import com.sheetdoc.app.models.CellValue;
import com.sheetdoc.app.models.SheetData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class FunctionLibraryTest {

    private FunctionLibrary library;
    private SheetEvaluator evaluator;
    private SheetData sheet;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-09T10:15:30Z"), ZoneOffset.UTC);
        library = FunctionLibrary.standard(clock, new Random(42));
        evaluator = new SheetEvaluator(library);

        // A1..A3 = 2, (empty), "x"
        sheet = SheetData.createEmpty(5, 5);
        sheet.setCell("A1", "2");
        sheet.setCell("A3", "x");
    }

    private EvaluatedCell eval(String formula) {
        sheet.setCell("E5", formula);
        return evaluator.evaluateCell(sheet, "E5", EvaluationOptions.standalone());
    }

    private String display(String formula) {
        EvaluatedCell cell = eval(formula);
        assertFalse(cell.hasError(), () -> formula + " failed: " + cell.getError());
        return cell.getDisplay();
    }

    private EvalErrorCode errorOf(String formula) {
        EvaluatedCell cell = eval(formula);
        assertTrue(cell.hasError(), () -> formula + " should fail but gave " + cell.getDisplay());
        return cell.getEvalError().getCode();
    }

    @Test
    void testRegistryIsCaseInsensitive() {
        assertTrue(library.isSupported("sum"));
        assertTrue(library.names().contains("IFERROR"));
        assertFalse(library.isSupported("VLOOKUP"));
        assertEquals("3", display("=sum(1, 2)"));
    }

    @Test
    void testUnsupportedFunction() {
        EvaluatedCell cell = eval("=FOO(1)");
        assertEquals(EvalErrorCode.UNSUPPORTED_FUNCTION, cell.getEvalError().getCode());
        assertEquals("Unsupported function FOO", cell.getError());
    }

    @Test
    void testCustomFunction() {
        library.register("twice", args -> args.values()
                .flatMap(values -> Result.ok(CellValue.number(values.get(0).asNumber() * 2))));
        assertEquals("42", display("=TWICE(21)"));
    }

    /**
     * SUM treats empty cells as 0; COUNT and COUNTA skip them.
     */
    @Test
    void testAggregates() {
        assertEquals("2", display("=SUM(A1:A2)"));
        assertEquals("2", display("=AVERAGE(A1:A3)"));
        assertEquals("1.5", display("=AVG(1, 2)"));
        assertEquals("9", display("=MAX(3, 9, 4)"));
        assertEquals("0", display("=MIN()"));
        assertEquals("1", display("=COUNT(A1:A3)"));
        assertEquals("2", display("=COUNTA(A1:A3)"));
        assertEquals(EvalErrorCode.NOT_NUMERIC, errorOf("=SUM(A1:A3)"));
    }

    @Test
    void testUnaryMath() {
        assertEquals("3", display("=ABS(-3)"));
        assertEquals("-3", display("=INT(-2.5)"));
        assertEquals("-1", display("=SIGN(-4)"));
        assertEquals(EvalErrorCode.ARGUMENT_COUNT, errorOf("=ABS(1, 2)"));
        assertEquals(EvalErrorCode.ARGUMENT_COUNT, errorOf("=ABS()"));
    }

    @Test
    void testRounding() {
        assertEquals("3", display("=ROUND(2.5)"));
        assertEquals("-2", display("=ROUND(-2.5)"));
        assertEquals("3.14", display("=ROUND(3.14159, 2)"));
        assertEquals("6", display("=FLOOR(7, 2)"));
        assertEquals("8", display("=CEILING(7, -2)"));
        assertEquals("-8", display("=FLOOR(-7, 2)"));
        assertEquals(EvalErrorCode.ZERO_SIGNIFICANCE, errorOf("=FLOOR(7, 0)"));
    }

    @Test
    void testPowersAndModulo() {
        assertEquals("4", display("=SQRT(16)"));
        assertEquals(EvalErrorCode.INVALID_ARGUMENT, errorOf("=SQRT(-1)"));
        assertEquals("1024", display("=POWER(2, 10)"));
        assertEquals("8", display("=POW(2, 3)"));
        assertEquals(EvalErrorCode.ARGUMENT_COUNT, errorOf("=POWER(2)"));
        assertEquals("1", display("=MOD(7, 3)"));
        assertEquals(EvalErrorCode.DIVISION_BY_ZERO, errorOf("=MOD(1, 0)"));
        assertEquals("3.14159265359", display("=PI()"));
    }

    @Test
    void testRandom() {
        double rand = eval("=RAND()").getValue().asNumber();
        assertTrue(rand >= 0 && rand < 1);

        for (int i = 0; i < 20; i++) {
            double roll = eval("=RANDBETWEEN(1, 6)").getValue().asNumber();
            assertTrue(roll >= 1 && roll <= 6 && roll == Math.floor(roll), "roll " + roll);
        }
        assertEquals(EvalErrorCode.INVALID_ARGUMENT, errorOf("=RANDBETWEEN(5, 1)"));
    }

    @Test
    void testTextFunctions() {
        assertEquals("a1TRUE", display("=CONCAT(\"a\", 1, TRUE)"));
        assertEquals("ab", display("=CONCATENATE(\"a\", \"b\")"));
        assertEquals("ABC", display("=UPPER(\"abc\")"));
        assertEquals("abc", display("=LOWER(\"ABC\")"));
        assertEquals("x", display("=TRIM(\"  x  \")"));
        assertEquals("4", display("=LEN(1/4)"));
        assertEquals("he", display("=LEFT(\"hello\", 2)"));
        assertEquals("o", display("=RIGHT(\"hello\")"));
        assertEquals("sheet", display("=MID(\"spreadsheet\", 7, 5)"));
    }

    @Test
    void testSubstituteAndRepeat() {
        assertEquals("a+b+c", display("=SUBSTITUTE(\"a-b-c\", \"-\", \"+\")"));
        assertEquals("a-b+c", display("=SUBSTITUTE(\"a-b-c\", \"-\", \"+\", 2)"));
        assertEquals(EvalErrorCode.INVALID_ARGUMENT, errorOf("=SUBSTITUTE(\"a\", \"a\", \"b\", 0)"));
        assertEquals("ababab", display("=REPT(\"ab\", 3)"));
        assertEquals(EvalErrorCode.INVALID_ARGUMENT, errorOf("=REPT(\"x\", 10001)"));
    }

    @Test
    void testFindAndSearch() {
        assertEquals("2", display("=FIND(\"b\", \"abcb\")"));
        assertEquals("4", display("=FIND(\"b\", \"abcb\", 3)"));
        assertEquals(EvalErrorCode.INVALID_ARGUMENT, errorOf("=FIND(\"B\", \"abc\")"));
        assertEquals("2", display("=SEARCH(\"B\", \"abc\")"));
    }

    /**
     * IF evaluates both branches; only IFERROR holds its fallback back.
     */
    @Test
    void testConditionals() {
        assertEquals("yes", display("=IF(1>0, \"yes\", \"no\")"));
        assertEquals(EvalErrorCode.DIVISION_BY_ZERO, errorOf("=IF(TRUE, 1, 1/0)"));
        assertEquals(EvalErrorCode.DIVISION_BY_ZERO, errorOf("=IF(FALSE, 1/0, 2)"));
        assertEquals("", display("=IF(FALSE, 1)"));
        assertEquals("fallback", display("=IFERROR(1/0, \"fallback\")"));
        assertEquals("5", display("=IFERROR(5, 1/0)"));
        assertEquals(EvalErrorCode.ARGUMENT_COUNT, errorOf("=IF(TRUE)"));
    }

    @Test
    void testLogicalFunctions() {
        assertEquals("TRUE", display("=AND(TRUE, 1)"));
        assertEquals("FALSE", display("=OR(FALSE, 0)"));
        assertEquals(EvalErrorCode.ARGUMENT_COUNT, errorOf("=AND()"));
        assertEquals("TRUE", display("=NOT(0)"));
        assertEquals("TRUE", display("=ISBLANK(A2)"));
        assertEquals("FALSE", display("=ISBLANK(A1)"));
        assertEquals("TRUE", display("=ISNUMBER(A1)"));
        assertEquals("FALSE", display("=ISNUMBER(\"5\")"));
        assertEquals("TRUE", display("=ISTEXT(A3)"));
    }

    @Test
    void testDateFunctions() {
        assertEquals("2024-03-09", display("=TODAY()"));
        assertEquals("2024-03-09T10:15:30.000Z", display("=NOW()"));
        assertEquals("2024", display("=YEAR(\"2024-03-09\")"));
        assertEquals("3", display("=MONTH(TODAY())"));
        assertEquals("9", display("=DAY(NOW())"));
        assertEquals(EvalErrorCode.INVALID_ARGUMENT, errorOf("=YEAR(\"not a date\")"));
        assertEquals(EvalErrorCode.INVALID_ARGUMENT, errorOf("=YEAR(\"2024-02-30\")"));
    }

    @Test
    void testParseDate() {
        assertNotNull(DateFunctions.parseDate("2024-03-09T10:15:30"));
        assertNull(DateFunctions.parseDate("03/09/2024"));
    }
}
