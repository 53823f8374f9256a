package com.civicgate.database;

/**
 * Raised by every read against a disabled session database.
 */
public class SinkUnavailableException extends RuntimeException {

    public static final String MESSAGE = "Session database not available";

    public SinkUnavailableException() {
        super(MESSAGE);
    }
}
