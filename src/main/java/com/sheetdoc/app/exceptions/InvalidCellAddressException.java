package com.sheetdoc.app.exceptions;

/**
 * Thrown when text that should name a cell is not an A1-style address,
 * for example "Invalid cell address: \"1A\"".
 */
public class InvalidCellAddressException extends RuntimeException {
    public InvalidCellAddressException(String message) {
        super(message);
    }
}
