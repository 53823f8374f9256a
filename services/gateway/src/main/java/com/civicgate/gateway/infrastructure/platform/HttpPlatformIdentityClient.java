package com.civicgate.gateway.infrastructure.platform;

import com.civicgate.security.AuthenticatedUser;
import com.civicgate.security.Credentials;
import com.civicgate.security.LoginGrant;
import com.civicgate.security.PlatformEndpoint;
import com.civicgate.security.PlatformEnvironment;
import com.civicgate.security.PlatformIdentityClient;
import com.civicgate.security.PlatformIdentityException;
import com.civicgate.security.RoleGrant;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PlatformIdentityClient} over the platform's HTTP API.
 *
 * <p>Logins use the OAuth password grant with form encoding and HTTP Basic client
 * authentication; user search and update post JSON bodies carrying a {@code RequestInfo} block.
 * A response is a failure when its status is not 2xx or it carries a non-empty {@code Errors}
 * array.
 */
public class HttpPlatformIdentityClient implements PlatformIdentityClient {

    private static final Logger log = LoggerFactory.getLogger(HttpPlatformIdentityClient.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String clientId;
    private final String clientSecret;
    private final Duration requestTimeout;
    private final Clock clock;

    public HttpPlatformIdentityClient(
            ObjectMapper mapper, String clientId, String clientSecret, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                mapper, clientId, clientSecret, requestTimeout, Clock.systemUTC());
    }

    HttpPlatformIdentityClient(HttpClient httpClient, ObjectMapper mapper, String clientId,
                               String clientSecret, Duration requestTimeout, Clock clock) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.clientId = clientId;
        this.clientSecret = clientSecret == null ? "" : clientSecret;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
    }

    @Override
    public LoginGrant login(PlatformEnvironment environment, Credentials credentials, String tenantId) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("username", credentials.username());
        form.put("password", credentials.password());
        form.put("userType", "EMPLOYEE");
        form.put("tenantId", tenantId);
        form.put("scope", "read");
        form.put("grant_type", "password");

        String basic = Base64.getEncoder()
                .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(URI.create(environment.endpointUrl(PlatformEndpoint.AUTH)))
                .timeout(requestTimeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Authorization", "Basic " + basic)
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(form), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response = send(request);
        JsonNode body = parse(response.body());
        if (!isSuccess(response.statusCode())) {
            String message = firstText(body, "error_description", "message");
            throw new PlatformIdentityException(
                    message != null ? message : "Login failed: " + response.statusCode(), response.statusCode());
        }
        String token = body.path("access_token").asText(null);
        JsonNode user = body.path("UserRequest");
        if (token == null || user.isMissingNode() || user.isNull()) {
            throw new PlatformIdentityException("Login response carried no token or user", response.statusCode());
        }
        return new LoginGrant(token, toUser(user));
    }

    @Override
    public Optional<AuthenticatedUser> searchUser(PlatformEnvironment environment, String accessToken,
                                                  String tenantId, String userName) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("RequestInfo", requestInfo(accessToken));
        body.put("tenantId", tenantId);
        body.put("userName", userName);
        body.put("pageSize", 1);

        JsonNode users = postJson(environment.endpointUrl(PlatformEndpoint.USER_SEARCH), accessToken, body)
                .path("user");
        if (!users.isArray() || users.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toUser(users.get(0)));
    }

    @Override
    public AuthenticatedUser updateRoles(PlatformEnvironment environment, String accessToken,
                                         AuthenticatedUser user, List<RoleGrant> roles) {
        Map<String, Object> record = new LinkedHashMap<>(user.profile());
        record.put("roles", roles.stream().map(HttpPlatformIdentityClient::roleJson).toList());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("RequestInfo", requestInfo(accessToken));
        body.put("user", record);

        JsonNode users = postJson(environment.endpointUrl(PlatformEndpoint.USER_UPDATE), accessToken, body)
                .path("user");
        if (users.isArray() && !users.isEmpty()) {
            return toUser(users.get(0));
        }
        return user.withRoles(roles);
    }

    private JsonNode postJson(String url, String accessToken, Map<String, Object> body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new PlatformIdentityException("Failed to encode request for " + url, e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        if (accessToken != null) {
            builder.header("Authorization", "Bearer " + accessToken);
        }

        HttpResponse<String> response = send(builder.build());
        JsonNode data = parse(response.body());
        JsonNode errors = data.path("Errors");
        if (!isSuccess(response.statusCode()) || (errors.isArray() && !errors.isEmpty())) {
            String message = errors.isArray() && !errors.isEmpty()
                    ? errors.get(0).path("message").asText("Request failed: " + response.statusCode())
                    : firstText(data, "message");
            throw new PlatformIdentityException(
                    message != null ? message : "Request failed: " + response.statusCode(), response.statusCode());
        }
        return data;
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Identity call to {} failed: {}", request.uri().getPath(), e.getMessage());
            throw new PlatformIdentityException("Identity service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformIdentityException("Interrupted calling the identity service", e);
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Identity response is not JSON: {}", e.getOriginalMessage());
            return mapper.createObjectNode();
        }
    }

    private Map<String, Object> requestInfo(String accessToken) {
        long now = clock.millis();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("apiId", "Rainmaker");
        info.put("ver", "1.0");
        info.put("ts", now);
        info.put("msgId", now + "|en_IN");
        info.put("authToken", accessToken == null ? "" : accessToken);
        return info;
    }

    private AuthenticatedUser toUser(JsonNode node) {
        List<RoleGrant> roles = new ArrayList<>();
        for (JsonNode role : node.path("roles")) {
            String code = role.path("code").asText(null);
            if (code != null && !code.isBlank()) {
                roles.add(new RoleGrant(code, role.path("name").asText(null), role.path("tenantId").asText(null)));
            }
        }
        Map<String, Object> profile = mapper.convertValue(node, MAP_TYPE);
        return new AuthenticatedUser(node.path("userName").asText(null), node.path("name").asText(null),
                node.path("uuid").asText(null), node.path("tenantId").asText(null), roles, profile);
    }

    private static Map<String, Object> roleJson(RoleGrant role) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("code", role.code());
        json.put("name", role.name());
        json.put("tenantId", role.tenantId());
        return json;
    }

    private static String formEncode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
