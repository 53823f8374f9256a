package com.civicgate.capability;

/**
 * Raised when a second descriptor is registered under an existing operation name.
 */
public class DuplicateOperationException extends RuntimeException {

    private final String operation;

    public DuplicateOperationException(String operation) {
        super("Operation already registered: " + operation);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
