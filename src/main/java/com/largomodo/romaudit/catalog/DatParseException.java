package com.largomodo.romaudit.catalog;

/**
 * Thrown when a DAT document is structurally broken and can not be imported.
 * Malformed single records are skipped with a warning instead.
 */
public class DatParseException extends RuntimeException {

    public DatParseException(String message) {
        super(message);
    }

    public DatParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
