package com.civicgate.capability;

import java.util.List;

/**
 * Raised when an operation exists but its group is not enabled.
 */
public class CapabilityDeniedException extends RuntimeException {

    private final String operation;
    private final String group;
    private final List<String> activeGroups;

    public CapabilityDeniedException(String operation, String group, List<String> activeGroups) {
        super("Tool \"" + operation + "\" is in the \"" + group
                + "\" group which is not currently enabled. Call enable_tools to enable it.");
        this.operation = operation;
        this.group = group;
        this.activeGroups = List.copyOf(activeGroups);
    }

    public String operation() {
        return operation;
    }

    public String group() {
        return group;
    }

    public List<String> activeGroups() {
        return activeGroups;
    }
}
