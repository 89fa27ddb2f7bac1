package com.sheetdoc.app.sheetdoc;

import com.sheetdoc.app.evaluation.NumberFormatting;
import com.sheetdoc.app.models.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Formats keys and values for the TOML body of a SheetDoc.
 */
final class TomlWriter {

    private static final Pattern BARE_KEY = Pattern.compile("^[A-Za-z0-9_-]+$");

    // integral doubles at or above this print without a fraction but overflow a TOML integer
    private static final double LONG_LIMIT = 9.2e18;

    private TomlWriter() {
    }

    static String key(String key) {
        return BARE_KEY.matcher(key).matches() ? key : string(key);
    }

    static String string(String value) {
        StringBuilder escaped = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '"':
                    escaped.append("\\\"");
                    break;
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\r':
                    escaped.append("\\r");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        escaped.append(String.format("\\u%04x", (int) c));
                    } else {
                        escaped.append(c);
                    }
            }
        }
        return escaped.append('"').toString();
    }

    static String number(double value) {
        if (!Double.isFinite(value)) {
            return "0";
        }
        String text = NumberFormatting.canonical(value);
        if (Math.abs(value) >= LONG_LIMIT && text.indexOf('.') < 0 && text.indexOf('e') < 0) {
            return text + ".0";
        }
        return text;
    }

    static String value(Object value) {
        if (value == null) {
            return string("");
        }
        if (value instanceof CellValue) {
            return cellValue((CellValue) value);
        }
        if (value instanceof String) {
            return string((String) value);
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "true" : "false";
        }
        if (value instanceof Long || value instanceof Integer) {
            return value.toString();
        }
        if (value instanceof Number) {
            return number(((Number) value).doubleValue());
        }
        if (value instanceof List) {
            List<String> parts = new ArrayList<>();
            for (Object item : (List<?>) value) {
                parts.add(value(item));
            }
            return "[" + String.join(", ", parts) + "]";
        }
        if (value instanceof Map) {
            return inlineTable((Map<?, ?>) value);
        }
        return string(value.toString());
    }

    static String inlineTable(Map<?, ?> table) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<?, ?> entry : table.entrySet()) {
            if (entry.getValue() != null) {
                parts.add(key(String.valueOf(entry.getKey())) + " = " + value(entry.getValue()));
            }
        }
        if (parts.isEmpty()) {
            return "{}";
        }
        return "{ " + String.join(", ", parts) + " }";
    }

    private static String cellValue(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return number(value.asNumber());
            case BOOLEAN:
                return value.asBoolean() ? "true" : "false";
            case STRING:
                return string(value.asString());
            default:
                return string("");
        }
    }
}
