package com.civicgate.capability;

import java.util.List;

/**
 * Result of a combined enable and disable request.
 *
 * @param enabled      report for the enable list
 * @param disabled     report for the disable list
 * @param activeGroups enabled groups afterwards, in catalog order
 */
public record GroupUpdate(GroupChange enabled, GroupChange disabled, List<String> activeGroups) {

    public GroupUpdate {
        activeGroups = List.copyOf(activeGroups);
    }

    public boolean changedAnything() {
        return enabled.changedAnything() || disabled.changedAnything();
    }
}
