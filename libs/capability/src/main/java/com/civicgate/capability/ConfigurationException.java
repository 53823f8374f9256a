package com.civicgate.capability;

/**
 * Raised for requests or registrations that reference something the gateway does not know:
 * an unknown operation, a group outside the catalog, arguments that fail the input schema.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
