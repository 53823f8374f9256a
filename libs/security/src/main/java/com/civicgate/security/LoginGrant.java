package com.civicgate.security;

/**
 * What the identity service hands back for a successful login.
 */
public record LoginGrant(String accessToken, AuthenticatedUser user) {

    @Override
    public String toString() {
        return "LoginGrant[accessToken=***, user=" + (user == null ? null : user.userName()) + "]";
    }
}
