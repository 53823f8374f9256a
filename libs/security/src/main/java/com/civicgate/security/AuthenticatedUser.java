package com.civicgate.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A platform account as returned by login or user search.
 *
 * @param userName login name
 * @param name     display name
 * @param uuid     platform user id
 * @param tenantId the account's home tenant
 * @param roles    roles held, each tagged to a tenant
 * @param profile  the full user record as the identity service returned it, echoed back on update
 */
public record AuthenticatedUser(
        String userName,
        String name,
        String uuid,
        String tenantId,
        List<RoleGrant> roles,
        Map<String, Object> profile
) {

    public AuthenticatedUser {
        if (userName == null || userName.isBlank()) {
            throw new IllegalArgumentException("userName must not be null or blank");
        }
        roles = roles == null ? List.of() : List.copyOf(roles);
        profile = profile == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(profile));
    }

    /**
     * Returns a copy holding {@code newRoles} instead of the current roles.
     */
    public AuthenticatedUser withRoles(List<RoleGrant> newRoles) {
        return new AuthenticatedUser(userName, name, uuid, tenantId, newRoles, profile);
    }

    public List<String> roleCodes() {
        return roles.stream().map(RoleGrant::code).distinct().toList();
    }
}
