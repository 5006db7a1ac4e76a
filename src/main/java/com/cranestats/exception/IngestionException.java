package com.cranestats.exception;

/**
 * A batch run could not start: log directory or tag-search file missing or unreadable.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
