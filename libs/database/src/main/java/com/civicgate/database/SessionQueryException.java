package com.civicgate.database;

/**
 * A dashboard query failed on a reachable database.
 */
public class SessionQueryException extends RuntimeException {

    public SessionQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
