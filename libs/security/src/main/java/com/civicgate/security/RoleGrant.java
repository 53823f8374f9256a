package com.civicgate.security;

/**
 * A role held on a tenant.
 *
 * @param code     role code (e.g. "EMPLOYEE")
 * @param name     display name
 * @param tenantId tenant the role is tagged to (nullable for untagged roles)
 */
public record RoleGrant(String code, String name, String tenantId) {

    public RoleGrant {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code must not be null or blank");
        }
        name = name == null ? code : name;
    }

    /**
     * A standard role tagged to {@code tenantId}, named after its code.
     */
    public static RoleGrant of(StandardRole role, String tenantId) {
        return new RoleGrant(role.code(), role.code(), tenantId);
    }
}
