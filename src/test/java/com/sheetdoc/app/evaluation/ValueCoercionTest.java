package com.sheetdoc.app.evaluation;

import com.sheetdoc.app.models.CellValue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueCoercionTest {

    @Test
    void testParseNumber() {
        assertEquals(12d, ValueCoercion.parseNumber(" 12 "));
        assertEquals(0d, ValueCoercion.parseNumber("   "));
        assertEquals(1000d, ValueCoercion.parseNumber("1e3"));
        assertEquals(-0.25, ValueCoercion.parseNumber("-.25"));
        assertNull(ValueCoercion.parseNumber("12abc"));
    }

    @Test
    void testCoerceNumber() {
        assertEquals(0d, ValueCoercion.coerceNumber(CellValue.EMPTY).getValue());
        assertEquals(1d, ValueCoercion.coerceNumber(CellValue.TRUE).getValue());
        assertEquals(4.5, ValueCoercion.coerceNumber(CellValue.string("4.5")).getValue());

        Result<Double> failed = ValueCoercion.coerceNumber(CellValue.string("abc"));
        assertTrue(failed.isError());
        assertEquals(EvalErrorCode.NOT_NUMERIC, failed.getError().getCode());
    }

    @Test
    void testToBoolean() {
        assertFalse(ValueCoercion.toBoolean(CellValue.EMPTY));
        assertFalse(ValueCoercion.toBoolean(CellValue.number(0)));
        assertTrue(ValueCoercion.toBoolean(CellValue.number(-2)));
        assertFalse(ValueCoercion.toBoolean(CellValue.string("false")));
        assertTrue(ValueCoercion.toBoolean(CellValue.string("TRUE")));
        assertFalse(ValueCoercion.toBoolean(CellValue.string("0")));
        assertTrue(ValueCoercion.toBoolean(CellValue.string("anything")));
    }

    @Test
    void testDisplay() {
        assertEquals("", ValueCoercion.display(CellValue.EMPTY));
        assertEquals("TRUE", ValueCoercion.display(CellValue.TRUE));
        assertEquals("FALSE", ValueCoercion.display(CellValue.FALSE));
        assertEquals("2.5", ValueCoercion.display(CellValue.number(2.5)));
        assertEquals("text", ValueCoercion.display(CellValue.string("text")));
    }
}
