package com.civicgate.security;

import java.util.List;

/**
 * A working login: held in process memory only, never recorded.
 *
 * @param environmentKey environment the token was issued by
 * @param accessToken    bearer credential
 * @param tenantRoot     tenant root the login resolved to
 * @param user           the logged-in account
 */
public record AuthContext(String environmentKey, String accessToken, String tenantRoot, AuthenticatedUser user) {

    public AuthContext {
        if (environmentKey == null || environmentKey.isBlank()) {
            throw new IllegalArgumentException("environmentKey must not be null or blank");
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken must not be null or blank");
        }
        if (user == null) {
            throw new IllegalArgumentException("user must not be null");
        }
    }

    public List<RoleGrant> roles() {
        return user.roles();
    }

    @Override
    public String toString() {
        return "AuthContext[environmentKey=" + environmentKey + ", accessToken=***, tenantRoot="
                + tenantRoot + ", user=" + user.userName() + "]";
    }
}
