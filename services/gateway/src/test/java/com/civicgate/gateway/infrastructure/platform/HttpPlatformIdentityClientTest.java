package com.civicgate.gateway.infrastructure.platform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.civicgate.security.AuthenticatedUser;
import com.civicgate.security.Credentials;
import com.civicgate.security.LoginGrant;
import com.civicgate.security.PlatformEnvironment;
import com.civicgate.security.PlatformIdentityException;
import com.civicgate.security.RoleGrant;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("HttpPlatformIdentityClient")
class HttpPlatformIdentityClientTest {

    private static final PlatformEnvironment ENV =
            new PlatformEnvironment("dev", "Dev", "https://dev.example.org/", "pg", null, null);

    private static final String LOGIN_BODY = """
            {
              "access_token": "tok-123",
              "UserRequest": {
                "userName": "ADMIN",
                "name": "Admin",
                "uuid": "u-1",
                "tenantId": "pg",
                "roles": [
                  {"code": "EMPLOYEE", "name": "Employee", "tenantId": "pg"},
                  {"code": "GRO", "name": "Grievance Routing Officer", "tenantId": "pg.citya"}
                ]
              }
            }
            """;

    private HttpClient httpClient;
    private HttpPlatformIdentityClient client;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        client = new HttpPlatformIdentityClient(httpClient, new ObjectMapper(), "egov-user-client", "",
                Duration.ofSeconds(5), Clock.fixed(Instant.parse("2025-07-12T10:30:00Z"), ZoneOffset.UTC));
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }

    @Nested
    @DisplayName("login")
    class Login {

        @Test
        @DisplayName("should post the password grant with basic client auth")
        void shouldPostPasswordGrant() throws Exception {
            respond(200, LOGIN_BODY);

            client.login(ENV, new Credentials("ADMIN", "eGov@123"), "pg");

            HttpRequest request = sentRequest();
            assertThat(request.uri().toString()).isEqualTo("https://dev.example.org/user/oauth/token");
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.headers().firstValue("Authorization")).hasValue("Basic ZWdvdi11c2VyLWNsaWVudDo=");
            assertThat(request.headers().firstValue("Content-Type"))
                    .hasValue("application/x-www-form-urlencoded");
        }

        @Test
        @DisplayName("should read the token and the user's roles")
        void shouldParseGrant() throws Exception {
            respond(200, LOGIN_BODY);

            LoginGrant grant = client.login(ENV, new Credentials("ADMIN", "eGov@123"), "pg");

            assertThat(grant.accessToken()).isEqualTo("tok-123");
            assertThat(grant.user().userName()).isEqualTo("ADMIN");
            assertThat(grant.user().tenantId()).isEqualTo("pg");
            assertThat(grant.user().roles()).extracting(RoleGrant::tenantId).containsExactly("pg", "pg.citya");
            assertThat(grant.user().profile()).containsEntry("uuid", "u-1");
        }

        @Test
        @DisplayName("should surface the error description of a rejected login")
        void shouldSurfaceErrorDescription() throws Exception {
            respond(400, "{\"error\": \"invalid_grant\", \"error_description\": \"Account locked\"}");

            assertThatThrownBy(() -> client.login(ENV, new Credentials("ADMIN", "x"), "pg"))
                    .isInstanceOf(PlatformIdentityException.class)
                    .hasMessage("Account locked")
                    .satisfies(e -> assertThat(((PlatformIdentityException) e).statusCode()).isEqualTo(400));
        }

        @Test
        @DisplayName("should fail on a non-JSON error page")
        void shouldFailOnHtmlError() throws Exception {
            respond(502, "<html>Bad Gateway</html>");

            assertThatThrownBy(() -> client.login(ENV, new Credentials("ADMIN", "x"), "pg"))
                    .isInstanceOf(PlatformIdentityException.class)
                    .hasMessage("Login failed: 502");
        }

        @Test
        @DisplayName("should wrap transport failures")
        void shouldWrapIoFailure() throws Exception {
            doThrow(new IOException("Connection refused")).when(httpClient).send(any(HttpRequest.class), any());

            assertThatThrownBy(() -> client.login(ENV, new Credentials("ADMIN", "x"), "pg"))
                    .isInstanceOf(PlatformIdentityException.class)
                    .hasMessageContaining("Connection refused")
                    .hasCauseInstanceOf(IOException.class);
        }
    }

    @Nested
    @DisplayName("user search and update")
    class Users {

        private final AuthenticatedUser admin = new AuthenticatedUser("ADMIN", "Admin", "u-1", "pg",
                List.of(new RoleGrant("EMPLOYEE", "Employee", "pg")),
                Map.of("userName", "ADMIN", "uuid", "u-1"));

        @Test
        @DisplayName("should send the bearer token and find the first user")
        void shouldFindUser() throws Exception {
            respond(200, "{\"user\": [{\"userName\": \"ADMIN\", \"tenantId\": \"pg\", \"roles\": []}]}");

            Optional<AuthenticatedUser> found = client.searchUser(ENV, "tok-123", "pg", "ADMIN");

            assertThat(found).map(AuthenticatedUser::userName).hasValue("ADMIN");
            HttpRequest request = sentRequest();
            assertThat(request.uri().getPath()).isEqualTo("/user/_search");
            assertThat(request.headers().firstValue("Authorization")).hasValue("Bearer tok-123");
        }

        @Test
        @DisplayName("should return empty when no user matches")
        void shouldReturnEmpty() throws Exception {
            respond(200, "{\"user\": []}");

            assertThat(client.searchUser(ENV, "tok-123", "pg", "GHOST")).isEmpty();
        }

        @Test
        @DisplayName("should treat an Errors array as a failure even on 200")
        void shouldFailOnErrorsArray() throws Exception {
            respond(200, """
                    {"Errors": [{"code": "InvalidAccessTokenException", "message": "Token expired"}]}
                    """);

            assertThatThrownBy(() -> client.searchUser(ENV, "tok-123", "pg", "ADMIN"))
                    .isInstanceOf(PlatformIdentityException.class)
                    .hasMessage("Token expired");
        }

        @Test
        @DisplayName("should fall back to the requested roles when the update echoes no user")
        void shouldFallBackToRequestedRoles() throws Exception {
            respond(200, "{}");
            var roles = List.of(new RoleGrant("EMPLOYEE", "Employee", "pg"),
                    new RoleGrant("GRO", "Grievance Routing Officer", "statea"));

            AuthenticatedUser updated = client.updateRoles(ENV, "tok-123", admin, roles);

            assertThat(updated.roles()).containsExactlyElementsOf(roles);
            assertThat(sentRequest().uri().getPath()).isEqualTo("/user/users/_updatenovalidate");
        }
    }
}
