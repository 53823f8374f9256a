package com.civicgate.security;

/**
 * A successful login.
 *
 * @param context       the context now in effect
 * @param loginTenant   the candidate the first login succeeded on
 * @param requestedRoot root derived from the caller's tenant (nullable when none was requested)
 * @param repair        role repair performed on the way (nullable when none was needed)
 */
public record LoginResult(AuthContext context, String loginTenant, String requestedRoot, RoleRepair repair) {

    public boolean repaired() {
        return repair != null;
    }
}
