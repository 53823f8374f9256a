package com.civicgate.capability;

import java.util.List;

/**
 * Told when the set of visible operations changes.
 */
@FunctionalInterface
public interface CapabilityChangeListener {

    /**
     * @param activeGroups enabled groups after the change, in catalog order
     */
    void capabilitiesChanged(List<String> activeGroups);
}
