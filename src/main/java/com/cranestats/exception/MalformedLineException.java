package com.cranestats.exception;

/**
 * A candidate log line that does not fit the tag line grammar. The line is skipped.
 */
public class MalformedLineException extends Exception {

    private final String reason;

    public MalformedLineException(String reason, String detail) {
        super(reason + ": " + detail);
        this.reason = reason;
    }

    /**
     * Short code such as BAD_LINE_STRUCTURE or BAD_TIMESTAMP.
     */
    public String getReason() {
        return reason;
    }
}
