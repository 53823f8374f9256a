package com.civicgate.capability;

import java.util.List;

/**
 * What an enable or disable request did.
 *
 * @param changed   ids whose state flipped
 * @param unchanged ids that were already in the requested state
 */
public record GroupChange(List<String> changed, List<String> unchanged) {

    public GroupChange {
        changed = List.copyOf(changed);
        unchanged = List.copyOf(unchanged);
    }

    public static GroupChange none() {
        return new GroupChange(List.of(), List.of());
    }

    public boolean changedAnything() {
        return !changed.isEmpty();
    }
}
