package com.sheetdoc.app.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A dynamically typed cell value: empty, a number, a string or a boolean.
 * EMPTY is the single empty-string equivalent; a STRING value is never "".
 */
public final class CellValue {

    public static final CellValue EMPTY = new CellValue(CellType.EMPTY, 0d, null, false);
    public static final CellValue TRUE = new CellValue(CellType.BOOLEAN, 0d, null, true);
    public static final CellValue FALSE = new CellValue(CellType.BOOLEAN, 0d, null, false);

    private final CellType type;
    private final double number;
    private final String text;
    private final boolean bool;

    private CellValue(CellType type, double number, String text, boolean bool) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
    }

    public static CellValue number(double value) {
        return new CellValue(CellType.NUMBER, value, null, false);
    }

    /**
     * A string value; "" collapses to EMPTY.
     */
    public static CellValue string(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY;
        }
        return new CellValue(CellType.STRING, 0d, value, false);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public CellType getType() {
        return type;
    }

    public boolean isEmpty() {
        return type == CellType.EMPTY;
    }

    public boolean isNumber() {
        return type == CellType.NUMBER;
    }

    public boolean isString() {
        return type == CellType.STRING;
    }

    public boolean isBoolean() {
        return type == CellType.BOOLEAN;
    }

    public double asNumber() {
        if (type != CellType.NUMBER) {
            throw new IllegalStateException("Not a number: " + type);
        }
        return number;
    }

    public String asString() {
        if (type != CellType.STRING) {
            throw new IllegalStateException("Not a string: " + type);
        }
        return text;
    }

    public boolean asBoolean() {
        if (type != CellType.BOOLEAN) {
            throw new IllegalStateException("Not a boolean: " + type);
        }
        return bool;
    }

    /**
     * Plain Java form used for JSON: "" for empty, a Long for whole numbers,
     * a Double otherwise, the String or the Boolean.
     */
    @JsonValue
    public Object toJavaValue() {
        switch (type) {
            case NUMBER:
                if (number == Math.rint(number) && Math.abs(number) < 1e15) {
                    return (long) number;
                }
                return number;
            case STRING:
                return text;
            case BOOLEAN:
                return bool;
            default:
                return "";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue that = (CellValue) o;
        return type == that.type
                && Double.compare(number, that.number) == 0
                && bool == that.bool
                && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool);
    }

    @Override
    public String toString() {
        return type + "(" + toJavaValue() + ")";
    }
}
