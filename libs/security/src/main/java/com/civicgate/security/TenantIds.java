package com.civicgate.security;

/**
 * Tenant ids are dotted paths; the segment before the first dot is the root
 * ("pg.citya" has root "pg").
 */
public final class TenantIds {

    private TenantIds() {
        // utility class
    }

    /**
     * Returns the root of a tenant id, or null for a null or blank id.
     */
    public static String root(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return null;
        }
        String trimmed = tenantId.trim();
        int dot = trimmed.indexOf('.');
        return dot < 0 ? trimmed : trimmed.substring(0, dot);
    }

    public static boolean isRoot(String tenantId) {
        return tenantId != null && !tenantId.isBlank() && tenantId.indexOf('.') < 0;
    }
}
