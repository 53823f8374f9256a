package com.civicgate.security;

import java.util.List;

/**
 * The authorization repair performed during a login.
 *
 * @param tenantRoot      root the roles were added on
 * @param rolesAdded      codes added, empty if the repair failed before the update
 * @param reauthenticated whether the follow-up login on {@code tenantRoot} succeeded
 * @param failure         why the repair did not complete (nullable)
 */
public record RoleRepair(String tenantRoot, List<String> rolesAdded, boolean reauthenticated, String failure) {

    public RoleRepair {
        rolesAdded = rolesAdded == null ? List.of() : List.copyOf(rolesAdded);
    }

    static RoleRepair failed(String tenantRoot, String failure) {
        return new RoleRepair(tenantRoot, List.of(), false, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
