package com.civicgate.security;

import java.util.List;

/**
 * Snapshot of the resolver's state.
 *
 * @param environment        active environment
 * @param tenantRootOverride state tenant chosen by the caller (nullable)
 * @param context            current login (nullable)
 * @param observedRoots      roots of successful logins in this environment, oldest first
 */
public record AuthState(
        PlatformEnvironment environment,
        String tenantRootOverride,
        AuthContext context,
        List<String> observedRoots
) {

    public AuthState {
        observedRoots = List.copyOf(observedRoots);
    }

    public boolean authenticated() {
        return context != null;
    }

    /**
     * The state tenant operations should use: the override if set, else the environment default.
     */
    public String stateTenant() {
        return tenantRootOverride != null ? tenantRootOverride : environment.stateTenantId();
    }

    public List<RoleGrant> roles() {
        return context == null ? List.of() : context.roles();
    }
}
