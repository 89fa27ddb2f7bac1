package com.sheetdoc.app.exceptions;

/**
 * Thrown when attempting to access a sheet ID
 * that doesn't exist in the sheet repository.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
