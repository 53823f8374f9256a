package com.civicgate.security;

/**
 * No working login could be obtained. The message never lists the individual tenants tried.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }
}
