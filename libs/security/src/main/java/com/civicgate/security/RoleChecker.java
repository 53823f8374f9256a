package com.civicgate.security;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Role checks scoped to a tenant root.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Returns the members of {@code required} that {@code grants} does not hold on
     * {@code tenantRoot}, in the order of {@code required}. Roles tagged to other tenants
     * do not count.
     */
    public static List<StandardRole> missingRoles(Collection<RoleGrant> grants, String tenantRoot,
                                                  Collection<StandardRole> required) {
        Set<String> held = grants.stream()
                .filter(g -> Objects.equals(g.tenantId(), tenantRoot))
                .map(RoleGrant::code)
                .collect(Collectors.toSet());
        return required.stream()
                .filter(role -> !held.contains(role.code()))
                .toList();
    }

    /**
     * Checks that every standard role is held on {@code tenantRoot}.
     */
    public static boolean hasStandardBundle(Collection<RoleGrant> grants, String tenantRoot) {
        return missingRoles(grants, tenantRoot, List.of(StandardRole.values())).isEmpty();
    }
}
