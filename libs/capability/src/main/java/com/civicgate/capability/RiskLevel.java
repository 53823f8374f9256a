package com.civicgate.capability;

/**
 * Whether an operation only reads from the platform or changes it.
 */
public enum RiskLevel {

    READ("read"),
    WRITE("write");

    private final String value;

    RiskLevel(String value) {
        this.value = value;
    }

    /** Lower-case form shown to callers. */
    public String value() {
        return value;
    }
}
