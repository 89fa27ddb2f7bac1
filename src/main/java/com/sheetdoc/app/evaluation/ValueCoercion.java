package com.sheetdoc.app.evaluation;

import com.sheetdoc.app.models.CellValue;

import java.util.regex.Pattern;

/**
 * Conversions between cell values, numbers, booleans and display text.
 */
public final class ValueCoercion {

    private static final Pattern NUMERIC_TEXT = Pattern.compile(
            "^[+-]?(?:(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?|Infinity)$");

    public static final String NOT_NUMERIC_MESSAGE = "Expected a numeric value";

    private ValueCoercion() {
    }

    /**
     * Parses trimmed text as a decimal number; blank text is 0.
     * Returns null when the text is not numeric.
     */
    public static Double parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0d;
        }
        if (!NUMERIC_TEXT.matcher(trimmed).matches()) {
            return null;
        }
        return Double.parseDouble(trimmed);
    }

    public static Result<Double> coerceNumber(CellValue value) {
        switch (value.getType()) {
            case EMPTY:
                return Result.ok(0d);
            case NUMBER:
                return Result.ok(value.asNumber());
            case BOOLEAN:
                return Result.ok(value.asBoolean() ? 1d : 0d);
            default:
                Double parsed = parseNumber(value.asString());
                if (parsed == null) {
                    return Result.fail(EvalErrorCode.NOT_NUMERIC, NOT_NUMERIC_MESSAGE);
                }
                return Result.ok(parsed);
        }
    }

    /**
     * True if {@link #coerceNumber} would succeed.
     */
    public static boolean isNumeric(CellValue value) {
        return coerceNumber(value).isOk();
    }

    public static boolean toBoolean(CellValue value) {
        switch (value.getType()) {
            case EMPTY:
                return false;
            case BOOLEAN:
                return value.asBoolean();
            case NUMBER:
                return value.asNumber() != 0;
            default:
                String trimmed = value.asString().trim();
                if (trimmed.isEmpty()) {
                    return false;
                }
                if (trimmed.equalsIgnoreCase("TRUE")) {
                    return true;
                }
                if (trimmed.equalsIgnoreCase("FALSE")) {
                    return false;
                }
                Double numeric = parseNumber(trimmed);
                if (numeric != null) {
                    return numeric != 0;
                }
                return true;
        }
    }

    public static String display(CellValue value) {
        switch (value.getType()) {
            case EMPTY:
                return "";
            case BOOLEAN:
                return value.asBoolean() ? "TRUE" : "FALSE";
            case NUMBER:
                return NumberFormatting.display(value.asNumber());
            default:
                return value.asString();
        }
    }
}
