package com.civicgate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns a requested tenant and credentials into a working {@link AuthContext}.
 * <p>
 * A login tries the roots of a {@link TenantCandidateList} in order and keeps the first
 * that works. When that root differs from the requested one, the account is given the
 * standard role bundle on the requested root and logged in again there; the outcome is
 * reported as a {@link RoleRepair} in the {@link LoginResult}.
 * <p>
 * Mutations hold a lock for the whole login sequence; readers get the latest immutable
 * {@link AuthState} without locking.
 */
public final class AuthResolver {

    private static final Logger log = LoggerFactory.getLogger(AuthResolver.class);

    static final String INVALID_CREDENTIALS = "Invalid login credentials";
    static final String MISSING_CREDENTIALS =
            "Username and password are required. Provide them as arguments or configure default credentials.";
    static final String NOT_AUTHENTICATED =
            "Not authenticated. Call the \"configure\" tool first, or configure default credentials.";

    private final EnvironmentCatalog catalog;
    private final PlatformIdentityClient client;
    private final Credentials defaultCredentials;
    private final String defaultLoginTenant;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile AuthState state;

    /**
     * @param catalog            configured environments
     * @param initialEnvironment key of the environment active at start
     * @param client             identity service
     * @param defaultCredentials credentials for lazy login (nullable)
     * @param defaultLoginTenant tenant for lazy login; the environment's state tenant when null
     */
    public AuthResolver(EnvironmentCatalog catalog, String initialEnvironment, PlatformIdentityClient client,
                        Credentials defaultCredentials, String defaultLoginTenant) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog must not be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        this.catalog = catalog;
        this.client = client;
        this.defaultCredentials = defaultCredentials == null ? Credentials.none() : defaultCredentials;
        this.defaultLoginTenant = blankToNull(defaultLoginTenant);
        this.state = new AuthState(catalog.get(initialEnvironment), null, null, List.of());
    }

    public AuthState state() {
        return state;
    }

    public Optional<AuthContext> context() {
        return Optional.ofNullable(state.context());
    }

    public PlatformEnvironment environment() {
        return state.environment();
    }

    public List<PlatformEnvironment> environments() {
        return catalog.all();
    }

    public Credentials defaultCredentials() {
        return defaultCredentials;
    }

    /**
     * Logs in, trying each candidate root in turn, and repairs missing roles on the requested
     * root when the login landed elsewhere.
     *
     * @param requestedTenant tenant the caller wants to work in, any depth (nullable)
     * @param credentials     account credentials
     * @throws AuthenticationException if credentials are missing or no candidate accepts them
     */
    public LoginResult login(String requestedTenant, Credentials credentials) {
        if (credentials == null || !credentials.isComplete()) {
            throw new AuthenticationException(MISSING_CREDENTIALS);
        }
        lock.lock();
        try {
            AuthState current = state;
            PlatformEnvironment env = current.environment();
            String requestedRoot = TenantIds.root(requestedTenant);
            String defaultTenant = defaultLoginTenant != null ? defaultLoginTenant : env.stateTenantId();
            TenantCandidateList candidates =
                    TenantCandidateList.build(requestedRoot, defaultTenant, current.observedRoots());

            LoginGrant grant = null;
            String usedTenant = null;
            for (String candidate : candidates.candidates()) {
                try {
                    grant = client.login(env, credentials, candidate);
                    usedTenant = candidate;
                    break;
                } catch (PlatformIdentityException e) {
                    log.debug("Login candidate rejected (status {})", e.statusCode());
                }
            }
            if (grant == null) {
                log.warn("Login failed on environment {} after {} candidate(s)", env.key(), candidates.size());
                throw new AuthenticationException(INVALID_CREDENTIALS);
            }

            List<String> observed = new ArrayList<>(current.observedRoots());
            addObserved(observed, usedTenant);
            addObserved(observed, TenantIds.root(grant.user().tenantId()));

            String resolvedRoot = usedTenant;
            RoleRepair repair = null;
            if (requestedRoot != null && !requestedRoot.equals(usedTenant)
                    && !RoleChecker.hasStandardBundle(grant.user().roles(), requestedRoot)) {
                RepairOutcome outcome = repair(env, credentials, grant, usedTenant, requestedRoot);
                repair = outcome.repair();
                if (outcome.grant() != null) {
                    grant = outcome.grant();
                    resolvedRoot = requestedRoot;
                    addObserved(observed, requestedRoot);
                }
            }

            AuthContext context = new AuthContext(env.key(), grant.accessToken(), resolvedRoot, grant.user());
            String override = requestedRoot != null ? requestedRoot : current.tenantRootOverride();
            state = new AuthState(env, override, context, observed);
            log.info("Authenticated {} on environment {} (tenant root {})",
                    grant.user().userName(), env.key(), resolvedRoot);
            return new LoginResult(context, usedTenant, requestedRoot, repair);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current context, logging in with the default credentials if there is none.
     *
     * @throws AuthenticationException if there is no context and no usable default credentials
     */
    public AuthContext ensureAuthenticated() {
        AuthContext existing = state.context();
        if (existing != null) {
            return existing;
        }
        lock.lock();
        try {
            existing = state.context();
            if (existing != null) {
                return existing;
            }
            if (!defaultCredentials.isComplete()) {
                throw new AuthenticationException(NOT_AUTHENTICATED);
            }
            return login(null, defaultCredentials).context();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes another environment active, discarding the login, the tenant override and the
     * observed roots.
     *
     * @throws IllegalArgumentException if the key is unknown
     */
    public PlatformEnvironment switchEnvironment(String key) {
        lock.lock();
        try {
            PlatformEnvironment env = catalog.get(key);
            state = new AuthState(env, null, null, List.of());
            log.info("Switched to environment {}", key);
            return env;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the state tenant for subsequent operations; only its root is kept.
     */
    public void setTenantRootOverride(String tenant) {
        lock.lock();
        try {
            AuthState current = state;
            state = new AuthState(current.environment(), TenantIds.root(tenant), current.context(),
                    current.observedRoots());
        } finally {
            lock.unlock();
        }
    }

    private RepairOutcome repair(PlatformEnvironment env, Credentials credentials, LoginGrant grant,
                                 String usedTenant, String requestedRoot) {
        try {
            String searchTenant = grant.user().tenantId() != null ? grant.user().tenantId() : usedTenant;
            Optional<AuthenticatedUser> found =
                    client.searchUser(env, grant.accessToken(), searchTenant, credentials.username());
            if (found.isEmpty()) {
                log.warn("Role repair on {} skipped: account not found on {}", requestedRoot, searchTenant);
                return new RepairOutcome(RoleRepair.failed(requestedRoot, "Account not found on " + searchTenant), null);
            }

            AuthenticatedUser account = found.get();
            List<StandardRole> missing =
                    RoleChecker.missingRoles(account.roles(), requestedRoot, List.of(StandardRole.values()));
            List<String> added = missing.stream().map(StandardRole::code).toList();
            if (!missing.isEmpty()) {
                List<RoleGrant> roles = new ArrayList<>(account.roles());
                missing.forEach(role -> roles.add(RoleGrant.of(role, requestedRoot)));
                client.updateRoles(env, grant.accessToken(), account, roles);
                log.info("Added roles {} on {} for {}", added, requestedRoot, account.userName());
            }

            try {
                LoginGrant relogin = client.login(env, credentials, requestedRoot);
                return new RepairOutcome(new RoleRepair(requestedRoot, added, true, null), relogin);
            } catch (PlatformIdentityException e) {
                log.warn("Re-login on {} failed after role repair: {}", requestedRoot, e.getMessage());
                return new RepairOutcome(new RoleRepair(requestedRoot, added, false,
                        "Re-login on " + requestedRoot + " failed: " + e.getMessage()), null);
            }
        } catch (PlatformIdentityException e) {
            log.warn("Role repair on {} failed: {}", requestedRoot, e.getMessage());
            return new RepairOutcome(RoleRepair.failed(requestedRoot, e.getMessage()), null);
        }
    }

    private static void addObserved(List<String> observed, String root) {
        if (root != null && !observed.contains(root)) {
            observed.add(root);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private record RepairOutcome(RoleRepair repair, LoginGrant grant) {
    }
}
