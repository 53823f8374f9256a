package com.civicgate.security;

import java.util.Optional;

/**
 * The platform's standard role bundle, granted per tenant root during role repair.
 */
public enum StandardRole {

    CITIZEN,
    EMPLOYEE,
    CSR,
    GRO,
    PGR_LME,
    DGRO,
    SUPERUSER;

    /** The role code as the identity service knows it. */
    public String code() {
        return name();
    }

    public static Optional<StandardRole> fromCode(String code) {
        for (StandardRole role : values()) {
            if (role.name().equals(code)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
