package com.civicgate.capability;

/**
 * Performs one operation. A thrown exception is treated the same as
 * {@link OperationOutcome#failure(String)} with the exception's message.
 */
@FunctionalInterface
public interface OperationHandler {

    OperationOutcome handle(OperationInput input) throws Exception;
}
