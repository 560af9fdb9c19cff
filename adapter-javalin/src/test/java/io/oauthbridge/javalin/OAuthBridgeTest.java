package io.oauthbridge.javalin;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.oauthbridge.core.error.OAuthException;
import io.oauthbridge.core.error.WebException;
import io.oauthbridge.core.model.Grant;
import io.oauthbridge.core.model.OAuthError;
import io.oauthbridge.core.model.ResourceOutcome;
import io.oauthbridge.core.operation.Authorize;
import io.oauthbridge.core.operation.EndpointWorker;
import io.oauthbridge.core.operation.Refresh;
import io.oauthbridge.core.operation.Token;
import io.oauthbridge.core.web.OAuthRequest;
import io.oauthbridge.core.web.OAuthResponse;
import io.oauthbridge.javalin.config.BridgeConfig;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * End-to-end tests: a real Javalin server on an ephemeral port, the engine
 * behind an {@link EndpointWorker}, requests sent with the JDK
 * {@link HttpClient}.
 */
@DisplayName("OAuthBridge on a running Javalin server")
class OAuthBridgeTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Grant GRANT =
            new Grant("alice", "client", "profile", null, Instant.parse("2030-01-01T00:00:00Z"));

    private static ScriptedEndpoint endpoint;
    private static EndpointWorker<OAuthRequest, OAuthResponse> worker;
    private static Javalin app;
    private static HttpClient client;
    private static String baseUrl;

    @BeforeAll
    static void startServer() {
        endpoint = new ScriptedEndpoint();
        OAuthBridge bridge = OAuthBridge.create(BridgeConfig.builder()
                .mailboxCapacity(16)
                .timeoutMs(5_000)
                .errorStatus(WebException.Kind.BODY, 400)
                .build());
        worker = bridge.startWorker(endpoint);

        app = Javalin.create();
        bridge.install(app);
        app.get("/authorize", bridge.handler(worker, Authorize::new));
        app.post("/authorize", bridge.handler(worker, Authorize::new));
        app.post("/token", bridge.handler(worker, Token::new));
        app.post("/refresh", bridge.handler(worker, Refresh::new));
        app.before("/api/*", bridge.resourceGuard(worker));
        app.get("/api/me", ctx -> ctx.result(OAuthBridge.grant(ctx).ownerId()));
        app.start(0);

        baseUrl = "http://127.0.0.1:" + app.port();
        client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterAll
    static void stopServer() throws InterruptedException {
        app.stop();
        worker.closeAndAwait(Duration.ofSeconds(5));
    }

    @BeforeEach
    void resetEndpoint() {
        endpoint.calls.clear();
        endpoint.authorize = r -> {
            OAuthResponse response = new OAuthResponse();
            response.redirect(URI.create(
                    "https://client.example/cb?code=" + r.query().uniqueValue("code")));
            return response;
        };
        endpoint.token = r -> {
            OAuthResponse response = new OAuthResponse();
            String grantType = r.urlBody().uniqueValue("grant_type");
            if (!"authorization_code".equals(grantType)) {
                response.clientError();
                response.bodyJson("{\"error\":\"unsupported_grant_type\"}");
                return response;
            }
            response.bodyJson("{\"access_token\":\"t-1\",\"token_type\":\"bearer\"}");
            return response;
        };
        endpoint.refresh = r -> {
            throw new OAuthException(OAuthError.PRIMITIVE_ERROR);
        };
        endpoint.resource = r -> {
            if ("Bearer t-1".equals(r.authHeader())) {
                return ResourceOutcome.granted(GRANT);
            }
            OAuthResponse denied = new OAuthResponse();
            denied.unauthorized("Bearer");
            return ResourceOutcome.denied(denied);
        };
    }

    private HttpResponse<String> send(HttpRequest.Builder request) throws Exception {
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Nested
    @DisplayName("authorization flow")
    class AuthorizationFlow {

        @Test
        @DisplayName("engine redirect → 302 with the exact Location")
        void redirectWithCode() throws Exception {
            HttpResponse<String> response =
                    send(HttpRequest.newBuilder(URI.create(baseUrl + "/authorize?code=abc&state=xyz")));

            assertThat(response.statusCode()).isEqualTo(302);
            assertThat(response.headers().firstValue("Location")).hasValue("https://client.example/cb?code=abc");
            assertThat(endpoint.calls).containsExactly("authorize");
        }

        @Test
        @DisplayName("form over the size limit → body absent, engine that ignores it still redirects")
        void oversizedFormIgnored() throws Exception {
            String form = "x=" + "a".repeat(1_100_000);

            HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(baseUrl + "/authorize?code=abc"))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(form)));

            assertThat(response.statusCode()).isEqualTo(302);
            assertThat(response.headers().firstValue("Location")).hasValue("https://client.example/cb?code=abc");
            assertThat(endpoint.calls).containsExactly("authorize");
        }

        @Test
        @DisplayName("two Authorization headers → 500 problem, engine never called")
        void duplicateAuthorization() throws Exception {
            HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(baseUrl + "/authorize?code=abc"))
                    .header("Authorization", "Basic YTpi")
                    .header("Authorization", "Basic YzpkOg=="));

            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(response.headers().firstValue("Content-Type"))
                    .hasValueSatisfying(ct -> assertThat(ct).contains("application/problem+json"));
            JsonNode body = MAPPER.readTree(response.body());
            assertThat(body.get("status").asInt()).isEqualTo(500);
            assertThat(body.get("instance").asText()).isEqualTo("/authorize");
            assertThat(endpoint.calls).isEmpty();
        }
    }

    @Nested
    @DisplayName("token flow")
    class TokenFlow {

        @Test
        @DisplayName("form body → engine's JSON answer")
        void formBody() throws Exception {
            HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(baseUrl + "/token"))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString("grant_type=authorization_code&code=abc")));

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type"))
                    .hasValueSatisfying(ct -> assertThat(ct).startsWith("application/json"));
            assertThat(MAPPER.readTree(response.body()).get("access_token").asText())
                    .isEqualTo("t-1");
        }

        @Test
        @DisplayName("engine client error → 400 with its body")
        void engineClientError() throws Exception {
            HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(baseUrl + "/token"))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString("grant_type=password")));

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(response.body()).isEqualTo("{\"error\":\"unsupported_grant_type\"}");
        }

        @Test
        @DisplayName("JSON body read by the engine → BODY, rendered with the configured 400")
        void jsonBodyIsAbsent() throws Exception {
            HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(baseUrl + "/token"))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString("{\"grant_type\":\"authorization_code\"}")));

            assertThat(response.statusCode()).isEqualTo(400);
            JsonNode body = MAPPER.readTree(response.body());
            assertThat(body.get("type").asText()).isEqualTo("urn:oauth-bridge:error:body");
            assertThat(body.get("detail").asText()).isEqualTo("No body present");
            assertThat(endpoint.calls).containsExactly("token");
        }

        @Test
        @DisplayName("engine protocol error → 500 without detail leakage")
        void protocolError() throws Exception {
            HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(baseUrl + "/refresh"))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString("grant_type=refresh_token&refresh_token=r")));

            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(response.body()).doesNotContain("primitive");
        }
    }

    @Nested
    @DisplayName("resource guard")
    class Guard {

        @Test
        @DisplayName("valid token → handler sees the grant")
        void granted() throws Exception {
            HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(baseUrl + "/api/me"))
                    .header("Authorization", "Bearer t-1"));

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo("alice");
        }

        @Test
        @DisplayName("missing token → engine's 401 challenge, handler skipped")
        void denied() throws Exception {
            HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(baseUrl + "/api/me")));

            assertThat(response.statusCode()).isEqualTo(401);
            assertThat(response.headers().firstValue("WWW-Authenticate")).hasValue("Bearer");
            assertThat(response.body()).isEmpty();
            assertThat(endpoint.calls).containsExactly("resource");
        }
    }
}
