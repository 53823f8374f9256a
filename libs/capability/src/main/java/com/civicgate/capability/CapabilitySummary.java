package com.civicgate.capability;

import java.util.List;
import java.util.Map;

/**
 * Discovery view of the registry.
 *
 * @param groups            per-group state keyed by group id, in catalog order, only groups with operations
 * @param totalOperations   number of registered operations
 * @param enabledOperations number of operations currently visible
 */
public record CapabilitySummary(Map<String, GroupSummary> groups, int totalOperations, int enabledOperations) {

    /**
     * @param enabled    whether the group is enabled
     * @param operations the group's operations in registration order
     */
    public record GroupSummary(boolean enabled, List<OperationSummary> operations) {
    }

    public record OperationSummary(String name, String category, String risk) {
    }
}
