package com.sheetdoc.app.exceptions;

/**
 * Thrown when a create, edit or import would leave a sheet larger than the
 * configured row or column limit.
 */
public class SheetTooLargeException extends RuntimeException {
    public SheetTooLargeException(String message) {
        super(message);
    }
}
