package com.sheetdoc.app.exceptions;

/**
 * Thrown by the strict SheetDoc reader when a document has no header,
 * carries an unsupported version, or its body is not valid TOML.
 * The lenient content parser catches it and falls back to an empty sheet.
 */
public class SheetDocFormatException extends RuntimeException {
    public SheetDocFormatException(String message) {
        super(message);
    }

    public SheetDocFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
