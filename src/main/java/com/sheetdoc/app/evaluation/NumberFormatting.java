package com.sheetdoc.app.evaluation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Text forms of numbers.
 * The canonical form is the shortest decimal that round-trips ("3", "0.5",
 * "1e+21"); it is what SheetDoc stores. The display form additionally rounds
 * anything longer than 12 characters to 12 significant digits, switching to
 * exponent notation when the exponent is 12 or more, or below -6.
 */
public final class NumberFormatting {

    public static final String ERROR_DISPLAY = "#ERROR";

    private static final int DISPLAY_WIDTH = 12;
    private static final MathContext DISPLAY_PRECISION = new MathContext(DISPLAY_WIDTH, RoundingMode.HALF_UP);

    private NumberFormatting() {
    }

    public static String canonical(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == 0d) {
            return "0";
        }
        return format(BigDecimal.valueOf(value).stripTrailingZeros());
    }

    public static String display(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return ERROR_DISPLAY;
        }
        String plain = canonical(value);
        if (plain.length() <= DISPLAY_WIDTH) {
            return plain;
        }
        BigDecimal rounded = BigDecimal.valueOf(value).round(DISPLAY_PRECISION).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -6 || exponent >= DISPLAY_WIDTH) {
            return exponential(rounded);
        }
        return rounded.toPlainString();
    }

    // plain notation between 1e-7 and 1e21, exponent notation outside
    private static String format(BigDecimal decimal) {
        double magnitude = Math.abs(decimal.doubleValue());
        if (magnitude >= 1e-7 && magnitude < 1e21) {
            return decimal.toPlainString();
        }
        return exponential(decimal);
    }

    // d.ddde+N with trailing zeros already stripped from the digits
    private static String exponential(BigDecimal decimal) {
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        StringBuilder text = new StringBuilder();
        if (decimal.signum() < 0) {
            text.append('-');
        }
        text.append(digits.charAt(0));
        if (digits.length() > 1) {
            text.append('.').append(digits, 1, digits.length());
        }
        text.append('e').append(exponent >= 0 ? '+' : '-').append(Math.abs(exponent));
        return text.toString();
    }
}
