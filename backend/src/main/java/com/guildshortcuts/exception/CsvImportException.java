package com.guildshortcuts.exception;

/**
 * Whole-file import failure. Raised before any row is written.
 */
public class CsvImportException extends RuntimeException {
    public CsvImportException(String message) {
        super(message);
    }

    public CsvImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
