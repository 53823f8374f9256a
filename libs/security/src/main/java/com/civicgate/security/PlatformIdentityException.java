package com.civicgate.security;

/**
 * A call to the identity service failed.
 */
public class PlatformIdentityException extends RuntimeException {

    private final int statusCode;

    public PlatformIdentityException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PlatformIdentityException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }
}
