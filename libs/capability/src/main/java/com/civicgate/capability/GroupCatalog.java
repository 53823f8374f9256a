package com.civicgate.capability;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The fixed, ordered set of group ids operations may belong to, one of which is always on.
 */
public final class GroupCatalog {

    /** The group that is always enabled. */
    public static final String CORE = "core";

    private static final List<String> PLATFORM_GROUPS = List.of(
            CORE, "mdms", "boundary", "masters", "employees", "localization", "pgr",
            "admin", "idgen", "location", "encryption", "docs", "monitoring", "tracing");

    private final List<String> ids;
    private final String alwaysOn;

    /**
     * @param ids      group ids in display order, without duplicates
     * @param alwaysOn the member that can never be disabled
     */
    public GroupCatalog(List<String> ids, String alwaysOn) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("ids must not be null or empty");
        }
        if (new LinkedHashSet<>(ids).size() != ids.size()) {
            throw new IllegalArgumentException("ids must not contain duplicates");
        }
        if (!ids.contains(alwaysOn)) {
            throw new IllegalArgumentException("alwaysOn must be one of the catalog ids");
        }
        this.ids = List.copyOf(ids);
        this.alwaysOn = alwaysOn;
    }

    /**
     * The groups of the civic services platform, with {@value #CORE} always on.
     */
    public static GroupCatalog platformDefault() {
        return new GroupCatalog(PLATFORM_GROUPS, CORE);
    }

    public List<String> ids() {
        return ids;
    }

    public String alwaysOn() {
        return alwaysOn;
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    /**
     * Fails with one {@link ConfigurationException} naming every id outside the catalog.
     */
    public void requireKnown(Collection<String> candidates) {
        List<String> unknown = new ArrayList<>();
        for (String id : candidates) {
            if (!contains(id)) {
                unknown.add(String.valueOf(id));
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Unknown tool group(s): " + String.join(", ", unknown)
                    + ". Valid groups: " + String.join(", ", ids));
        }
    }

    /**
     * Returns the members of {@code groups} in catalog order.
     */
    public List<String> inCatalogOrder(Set<String> groups) {
        return ids.stream().filter(groups::contains).toList();
    }
}
