package com.civicgate.gateway.operations;

import com.civicgate.capability.CapabilityRegistry;
import com.civicgate.capability.CapabilitySummary;
import com.civicgate.capability.GroupCatalog;
import com.civicgate.capability.GroupChange;
import com.civicgate.capability.GroupUpdate;
import com.civicgate.capability.InputSchema;
import com.civicgate.capability.OperationDescriptor;
import com.civicgate.capability.OperationInput;
import com.civicgate.capability.OperationOutcome;
import com.civicgate.capability.PropertyType;
import com.civicgate.capability.RiskLevel;
import com.civicgate.eventmodel.MessageTurn;
import com.civicgate.security.AuthResolver;
import com.civicgate.security.AuthState;
import com.civicgate.security.AuthenticatedUser;
import com.civicgate.security.Credentials;
import com.civicgate.security.LoginResult;
import com.civicgate.security.PlatformEnvironment;
import com.civicgate.security.RoleRepair;
import com.civicgate.telemetry.CheckpointReceipt;
import com.civicgate.telemetry.SessionTelemetry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The built-in operations of the {@value GroupCatalog#CORE} group: discovery, group toggling,
 * session bookkeeping and environment login.
 *
 * <p>Results are pretty-printed JSON documents with a {@code success} flag.
 */
public class CoreOperations {

    public static final String DISCOVER_TOOLS = "discover_tools";
    public static final String ENABLE_TOOLS = "enable_tools";
    public static final String SESSION_CHECKPOINT = "session_checkpoint";
    public static final String INIT = "init";
    public static final String CONFIGURE = "configure";
    public static final String GET_ENVIRONMENT_INFO = "get_environment_info";

    static final String GROUPS_USAGE = "Call enable_tools with group names to load more tools. Groups: "
            + "mdms (tenant validation + MDMS CRUD), boundary (boundary hierarchy + boundary management), "
            + "masters (departments, designations, complaint types), employees (HRMS employee "
            + "create/update/validate), localization (UI labels), pgr (complaints + workflow), admin "
            + "(filestore upload/download + access control + user search/create), idgen (ID generation), "
            + "location (geographic boundaries), encryption (encrypt/decrypt data), docs (search platform "
            + "documentation), monitoring (service health), tracing (request traces).";

    private final CapabilityRegistry registry;
    private final SessionTelemetry telemetry;
    private final AuthResolver authResolver;
    private final ObjectMapper mapper;

    public CoreOperations(CapabilityRegistry registry, SessionTelemetry telemetry, AuthResolver authResolver,
                          ObjectMapper mapper) {
        this.registry = registry;
        this.telemetry = telemetry;
        this.authResolver = authResolver;
        this.mapper = mapper;
    }

    /**
     * Registers every core operation.
     */
    public void registerAll() {
        descriptors().forEach(registry::register);
    }

    public List<OperationDescriptor> descriptors() {
        List<String> groups = registry.catalog().ids();
        List<String> environments = authResolver.environments().stream().map(PlatformEnvironment::key).toList();

        return List.of(
                OperationDescriptor.builder(DISCOVER_TOOLS)
                        .category("discovery")
                        .description("List all available tools grouped by domain. Shows which groups are "
                                + "currently enabled and what tools each group contains.")
                        .handler(this::discoverTools)
                        .build(),
                OperationDescriptor.builder(ENABLE_TOOLS)
                        .category("discovery")
                        .description("Enable or disable tool groups on demand. The \"core\" group is "
                                + "always enabled and is ignored in a disable request.")
                        .inputSchema(InputSchema.builder()
                                .optionalEnumArray("enable", groups, "Groups to enable (e.g. [\"mdms\", \"pgr\"])")
                                .optionalEnumArray("disable", groups, "Groups to disable (\"core\" is ignored)")
                                .build())
                        .handler(this::enableTools)
                        .build(),
                OperationDescriptor.builder(SESSION_CHECKPOINT)
                        .category("sessions")
                        .risk(RiskLevel.WRITE)
                        .description("Record a checkpoint summarizing your progress so far. Call this "
                                + "periodically (every 5-10 tool calls) to capture what you accomplished.")
                        .inputSchema(InputSchema.builder()
                                .required("summary", PropertyType.STRING,
                                        "What you accomplished since the last checkpoint or session start")
                                .optional("messages", PropertyType.ARRAY,
                                        "Conversation turns to persist, each with turn, role and content")
                                .build())
                        .handler(this::sessionCheckpoint)
                        .build(),
                OperationDescriptor.builder(INIT)
                        .category("sessions")
                        .risk(RiskLevel.WRITE)
                        .description("Start the session by saying who you are and what you are trying to do.")
                        .inputSchema(InputSchema.builder()
                                .required("user_name", PropertyType.STRING, "Who is driving this session")
                                .required("purpose", PropertyType.STRING, "What the session is for")
                                .optional("telemetry", PropertyType.BOOLEAN,
                                        "Whether the session may be used for analysis (default true)")
                                .build())
                        .handler(this::init)
                        .build(),
                OperationDescriptor.builder(CONFIGURE)
                        .category("environment")
                        .description("Connect to a platform environment by logging in. Must be called before "
                                + "any tool that queries the platform unless default credentials are configured.")
                        .inputSchema(InputSchema.builder()
                                .optionalEnum("environment", environments, "Environment to connect to")
                                .optional("username", PropertyType.STRING, "Platform username")
                                .optional("password", PropertyType.STRING, "Platform password")
                                .optional("tenant_id", PropertyType.STRING,
                                        "Tenant to work in; its root becomes the state tenant")
                                .optional("state_tenant", PropertyType.STRING,
                                        "Root state tenant for all subsequent operations")
                                .build())
                        .handler(this::configure)
                        .build(),
                OperationDescriptor.builder(GET_ENVIRONMENT_INFO)
                        .category("environment")
                        .description("Show the current environment (name, URL, state tenant) and list all "
                                + "available environments. Can switch environment or change the state tenant.")
                        .inputSchema(InputSchema.builder()
                                .optionalEnum("switch_to", environments, "Environment to switch to first")
                                .optional("state_tenant", PropertyType.STRING, "Root state tenant override")
                                .build())
                        .handler(this::environmentInfo)
                        .build());
    }

    OperationOutcome discoverTools(OperationInput input) throws JsonProcessingException {
        CapabilitySummary summary = registry.summary();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", summary.enabledOperations() + " of " + summary.totalOperations() + " tools enabled");
        body.put("groups", summary.groups());
        body.put("usage", GROUPS_USAGE);
        return json(body);
    }

    OperationOutcome enableTools(OperationInput input) throws JsonProcessingException {
        List<String> enable = input.strings("enable");
        List<String> disable = input.strings("disable");
        GroupUpdate update = registry.updateGroups(enable, disable);
        CapabilitySummary summary = registry.summary();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("enabled", enable.isEmpty() ? null : change(update.enabled()));
        body.put("disabled", disable.isEmpty() ? null : change(update.disabled()));
        body.put("activeGroups", update.activeGroups());
        body.put("toolCount", summary.enabledOperations() + " of " + summary.totalOperations()
                + " tools now enabled");
        return json(body);
    }

    OperationOutcome sessionCheckpoint(OperationInput input) throws JsonProcessingException {
        Object summary = input.args().get("summary");
        List<MessageTurn> turns = messageTurns(input.objects("messages"));
        CheckpointReceipt receipt = telemetry.recordCheckpoint(input.sessionId(),
                summary instanceof String s ? s : null, turns);

        Map<String, Object> checkpoint = new LinkedHashMap<>();
        checkpoint.put("sessionId", receipt.sessionId());
        checkpoint.put("seq", receipt.seq());
        checkpoint.put("ts", receipt.timestamp().toString());
        checkpoint.put("summary", receipt.summary());
        checkpoint.put("recentTools", receipt.recentOperations());

        Map<String, Object> session = new LinkedHashMap<>();
        session.put("toolCount", receipt.toolCount());
        session.put("checkpointCount", receipt.checkpointCount());
        session.put("errorCount", receipt.errorCount());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("checkpoint", checkpoint);
        body.put("session", session);
        return json(body);
    }

    OperationOutcome init(OperationInput input) throws JsonProcessingException {
        String userName = input.string("user_name").orElse(null);
        String purpose = input.string("purpose").orElse(null);
        if (userName == null || purpose == null) {
            return OperationOutcome.failure("user_name and purpose must not be blank");
        }
        boolean telemetryEnabled = input.bool("telemetry", true);
        telemetry.attributeUser(input.sessionId(), userName, purpose, telemetryEnabled);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("sessionId", input.sessionId());
        body.put("telemetry", telemetryEnabled);
        body.put("message", "Session initialized for \"" + userName + "\"");
        return json(body);
    }

    OperationOutcome configure(OperationInput input) throws JsonProcessingException {
        input.string("environment").ifPresent(authResolver::switchEnvironment);

        Credentials credentials = new Credentials(input.string("username").orElse(null),
                input.string("password").orElse(null)).orDefaults(authResolver.defaultCredentials());
        String requestedTenant = input.string("tenant_id").or(() -> input.string("state_tenant")).orElse(null);
        if (!credentials.isComplete() && requestedTenant != null) {
            authResolver.setTenantRootOverride(requestedTenant);
        }

        LoginResult login = authResolver.login(requestedTenant, credentials);
        AuthState state = authResolver.state();
        PlatformEnvironment env = state.environment();
        AuthenticatedUser user = login.context().user();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Authenticated as \"" + credentials.username() + "\" on " + env.name());
        body.put("environment", Map.of("name", env.name(), "url", env.url()));
        body.put("stateTenantId", state.stateTenant());
        body.put("loginTenantId", login.context().tenantRoot());
        Optional.ofNullable(login.repair()).ifPresent(repair -> body.put("rolesProvisioned", repair(repair)));

        Map<String, Object> userJson = new LinkedHashMap<>();
        userJson.put("userName", user.userName());
        userJson.put("name", user.name());
        userJson.put("tenantId", user.tenantId());
        userJson.put("roles", user.roleCodes());
        body.put("user", userJson);
        return json(body);
    }

    OperationOutcome environmentInfo(OperationInput input) throws JsonProcessingException {
        input.string("switch_to").ifPresent(authResolver::switchEnvironment);
        input.string("state_tenant").ifPresent(authResolver::setTenantRootOverride);

        AuthState state = authResolver.state();
        PlatformEnvironment env = state.environment();

        Map<String, Object> current = new LinkedHashMap<>();
        current.put("name", env.name());
        current.put("url", env.url());
        current.put("stateTenantId", state.stateTenant());

        Map<String, Object> user = null;
        if (state.authenticated()) {
            user = new LinkedHashMap<>();
            user.put("userName", state.context().user().userName());
            user.put("tenantId", state.context().user().tenantId());
        }

        List<Map<String, Object>> available = new ArrayList<>();
        for (PlatformEnvironment candidate : authResolver.environments()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("key", candidate.key());
            entry.put("name", candidate.name());
            entry.put("url", candidate.url());
            entry.put("defaultStateTenantId", candidate.stateTenantId());
            available.add(entry);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("current", current);
        body.put("authenticated", state.authenticated());
        body.put("user", user);
        body.put("available", available);
        return json(body);
    }

    private static Map<String, Object> change(GroupChange change) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("changed", change.changed());
        json.put("unchanged", change.unchanged());
        return json;
    }

    private static Map<String, Object> repair(RoleRepair repair) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("tenant", repair.tenantRoot());
        json.put("roles", repair.rolesAdded());
        json.put("reauthenticated", repair.reauthenticated());
        if (repair.succeeded()) {
            json.put("note", "Added roles for \"" + repair.tenantRoot()
                    + "\" so direct API login with this tenant now works.");
        } else {
            json.put("failure", repair.failure());
        }
        return json;
    }

    private static List<MessageTurn> messageTurns(List<Map<String, Object>> raw) {
        List<MessageTurn> turns = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            Map<String, Object> item = raw.get(i);
            if (!(item.get("turn") instanceof Number turn)) {
                throw new IllegalArgumentException("messages[" + i + "].turn must be an integer");
            }
            if (!(item.get("role") instanceof String role)) {
                throw new IllegalArgumentException("messages[" + i + "].role must be a string");
            }
            turns.add(new MessageTurn(turn.intValue(), role, item.get("content")));
        }
        return turns;
    }

    private OperationOutcome json(Map<String, Object> body) throws JsonProcessingException {
        return OperationOutcome.success(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(body));
    }
}
