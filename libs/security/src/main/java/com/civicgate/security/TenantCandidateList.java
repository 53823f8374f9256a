package com.civicgate.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, de-duplicated tenant roots to try a login against: the requested root first,
 * then the environment default root, then roots seen on earlier successful logins.
 *
 * @param candidates roots in attempt order
 */
public record TenantCandidateList(List<String> candidates) {

    public TenantCandidateList {
        candidates = List.copyOf(candidates);
    }

    /**
     * @param requestedTenant tenant the caller asked for, any depth (nullable)
     * @param defaultTenant   the environment's default tenant (nullable)
     * @param observedRoots   roots of earlier successful logins, oldest first
     */
    public static TenantCandidateList build(String requestedTenant, String defaultTenant,
                                            Collection<String> observedRoots) {
        Set<String> ordered = new LinkedHashSet<>();
        addRoot(ordered, requestedTenant);
        addRoot(ordered, defaultTenant);
        if (observedRoots != null) {
            observedRoots.forEach(root -> addRoot(ordered, root));
        }
        return new TenantCandidateList(new ArrayList<>(ordered));
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public int size() {
        return candidates.size();
    }

    private static void addRoot(Set<String> ordered, String tenant) {
        String root = TenantIds.root(tenant);
        if (root != null) {
            ordered.add(root);
        }
    }
}
