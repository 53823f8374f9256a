package com.civicgate.security;

import java.util.List;
import java.util.Optional;

/**
 * The platform's identity service as the resolver needs it.
 */
public interface PlatformIdentityClient {

    /**
     * Logs in on one tenant.
     *
     * @throws PlatformIdentityException if the service rejects the login or cannot be reached
     */
    LoginGrant login(PlatformEnvironment environment, Credentials credentials, String tenantId);

    /**
     * Finds an account by user name on a tenant.
     */
    Optional<AuthenticatedUser> searchUser(PlatformEnvironment environment, String accessToken,
                                           String tenantId, String userName);

    /**
     * Replaces the account's role set.
     *
     * @return the updated account
     */
    AuthenticatedUser updateRoles(PlatformEnvironment environment, String accessToken,
                                  AuthenticatedUser user, List<RoleGrant> roles);
}
