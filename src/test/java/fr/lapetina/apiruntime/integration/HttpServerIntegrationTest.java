package fr.lapetina.apiruntime.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.apiruntime.api.HttpServer;
import fr.lapetina.apiruntime.infrastructure.config.ApiServerConfig;
import fr.lapetina.apiruntime.infrastructure.jobs.JobRequest;
import fr.lapetina.apiruntime.infrastructure.reload.ConfigReloadLoop;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests over HTTP.
 * Configuration is externalized to test-config.yaml.
 */
class HttpServerIntegrationTest {

    private static final String TEST_SECRET = "test-secret-with-at-least-thirty-two-bytes";
    private static final String ROTATED_SECRET = "rotated-secret-with-at-least-thirty-two-bytes";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private TestRuntimeFactory factory;
    private HttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        factory = TestRuntimeFactory.create();
        server = new HttpServer(
                "127.0.0.1",
                0,
                50,
                factory.getState(),
                factory.getLimiter(),
                factory.getReloadLoop(),
                factory.getMetricsRegistry(),
                true
        );
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
        if (factory != null) {
            factory.close();
        }
    }

    private static String token(String secret, String subject, String scope) {
        return Jwts.builder()
                .subject(subject)
                .claim("scope", scope)
                .expiration(Date.from(Instant.now().plusSeconds(300)))
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }

    private HttpResponse<String> get(String path, String token) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .timeout(Duration.ofSeconds(5))
                .GET();
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String token) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .timeout(Duration.ofSeconds(5))
                .header("Authorization", "Bearer " + token)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return objectMapper.readTree(response.body());
    }

    @Test
    @DisplayName("health should answer on every call, never rate limited")
    void healthShouldNeverBeLimited() throws Exception {
        for (int i = 0; i < 30; i++) {
            HttpResponse<String> response = get("/health", null);
            assertThat(response.statusCode()).isEqualTo(200);
        }
        assertThat(json(get("/health", null)).get("status").asText()).isEqualTo("UP");
    }

    @Test
    @DisplayName("metrics should be exposed in Prometheus format")
    void metricsShouldBeExposed() throws Exception {
        get("/api/whoami", null);

        HttpResponse<String> response = get("/metrics", null);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("api_runtime_rate_limit_decisions_total");
    }

    @Nested
    @DisplayName("Authentication")
    class AuthenticationTests {

        @Test
        @DisplayName("whoami should report the token subject and scopes")
        void whoamiShouldReportSubject() throws Exception {
            HttpResponse<String> response = get("/api/whoami", token(TEST_SECRET, "alice", "read write"));

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = json(response);
            assertThat(body.get("subject").asText()).isEqualTo("alice");
            assertThat(body.get("authenticated").asBoolean()).isTrue();
            assertThat(body.get("scopes")).hasSize(2);
        }

        @Test
        @DisplayName("whoami without a token should report an anonymous caller")
        void whoamiShouldAllowAnonymous() throws Exception {
            JsonNode body = json(get("/api/whoami", null));

            assertThat(body.get("authenticated").asBoolean()).isFalse();
            assertThat(body.get("subject").isNull()).isTrue();
        }

        @Test
        @DisplayName("a token signed with another key should be rejected")
        void foreignTokenShouldBeRejected() throws Exception {
            HttpResponse<String> response = get("/api/whoami", token(ROTATED_SECRET, "mallory", "admin"));

            assertThat(response.statusCode()).isEqualTo(401);
        }

        @Test
        @DisplayName("unknown API paths should return 404")
        void unknownPathShouldReturn404() throws Exception {
            assertThat(get("/api/nothing-here", null).statusCode()).isEqualTo(404);
        }
    }

    @Nested
    @DisplayName("Admin endpoints")
    class AdminTests {

        @Test
        @DisplayName("should require the admin scope")
        void shouldRequireAdminScope() throws Exception {
            assertThat(get("/admin/runtime", token(TEST_SECRET, "alice", "read")).statusCode()).isEqualTo(403);
            assertThat(get("/admin/runtime", null).statusCode()).isEqualTo(403);
        }

        @Test
        @DisplayName("runtime view should describe the key and mask secrets")
        void runtimeShouldDescribeKey() throws Exception {
            HttpResponse<String> response = get("/admin/runtime", token(TEST_SECRET, "root", "admin"));

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = json(response);
            assertThat(body.get("key").get("label").asText()).isEqualTo("HS256(secret)");
            assertThat(body.get("key").get("fingerprint").asText()).matches("[0-9a-f]{12}");
            assertThat(body.get("key").get("bits").asInt()).isEqualTo(TEST_SECRET.length() * 8);
            assertThat(body.get("config").get("auth").get("jwtSecret").asText()).isEqualTo("***");
            assertThat(body.get("rateLimiter").get("burst").asInt()).isEqualTo(10);
            assertThat(response.body()).doesNotContain(TEST_SECRET);
        }

        @Test
        @DisplayName("manual reload should report UNCHANGED when nothing changed")
        void reloadShouldReportUnchanged() throws Exception {
            HttpResponse<String> response = post("/admin/reload", token(TEST_SECRET, "root", "admin"));

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(json(response).get("outcome").asText()).isEqualTo("UNCHANGED");
        }

        @Test
        @DisplayName("manual reload should report 422 when the source cannot be loaded")
        void reloadShouldReportLoadFailure() throws Exception {
            factory.breakSource();

            HttpResponse<String> response = post("/admin/reload", token(TEST_SECRET, "root", "admin"));

            assertThat(response.statusCode()).isEqualTo(422);
            assertThat(json(response).get("outcome").asText()).isEqualTo("LOAD_FAILED");
        }
    }

    @Nested
    @DisplayName("Live reconfiguration")
    class ReconfigurationTests {

        @Test
        @DisplayName("rotating the secret should switch which tokens are accepted")
        void secretRotationShouldSwapVerifier() throws Exception {
            String adminToken = token(TEST_SECRET, "root", "admin");
            ApiServerConfig current = factory.getReloadLoop().currentConfig();
            factory.setConfig(current.withAuth(ApiServerConfig.AuthConfig.of(null, null, ROTATED_SECRET)));

            HttpResponse<String> reload = post("/admin/reload", adminToken);

            assertThat(json(reload).get("outcome").asText()).isEqualTo("APPLIED");
            assertThat(get("/api/whoami", token(TEST_SECRET, "alice", "read")).statusCode()).isEqualTo(401);
            assertThat(get("/api/whoami", token(ROTATED_SECRET, "alice", "read")).statusCode()).isEqualTo(200);

            List<JobRequest> jobs = factory.getJobQueue().drain();
            assertThat(jobs).extracting(JobRequest::type).containsExactly(ConfigReloadLoop.RELOAD_JOB_TYPE);
            assertThat(jobs.get(0).payload().toString()).doesNotContain(ROTATED_SECRET);
        }

        @Test
        @DisplayName("a log level change should reach the level reloader")
        void logLevelChangeShouldBeApplied() {
            ApiServerConfig current = factory.getReloadLoop().currentConfig();
            factory.setConfig(current.withLogging(ApiServerConfig.LoggingConfig.of("error", null)));

            factory.getReloadLoop().runCycle();

            assertThat(factory.getAppliedLevels()).last().isEqualTo("error");
        }

        @Test
        @DisplayName("new sweep settings should reach the bucket sweeper")
        void sweepSettingsShouldBeApplied() {
            ApiServerConfig current = factory.getReloadLoop().currentConfig();
            ApiServerConfig.RateLimitConfig rateLimit = current.rateLimit();
            factory.setConfig(current.withRateLimit(ApiServerConfig.RateLimitConfig.of(
                    rateLimit.enabled(), rateLimit.perIp(), rateLimit.perUser(), rateLimit.ratePerSec(),
                    rateLimit.burst(), rateLimit.exemptPaths(), 15_000L, 10.0)));

            factory.getReloadLoop().runCycle();

            assertThat(factory.getBucketSweeper().getIdleMultiplier()).isEqualTo(10.0);
            assertThat(factory.getBucketSweeper().getSweepInterval()).isEqualTo(Duration.ofSeconds(15));
        }

        @Test
        @DisplayName("reload jobs should be consumed once the runtime is started")
        void reloadJobsShouldBeConsumed() throws Exception {
            factory.start();
            ApiServerConfig current = factory.getReloadLoop().currentConfig();
            factory.setConfig(current.withLogging(ApiServerConfig.LoggingConfig.of("error", null)));

            factory.getReloadLoop().runCycle();

            long deadline = System.currentTimeMillis() + 5_000;
            while (factory.getJobWorker().orElseThrow().getProcessedCount() == 0
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(factory.getJobWorker().orElseThrow().getProcessedCount()).isEqualTo(1);
            assertThat(factory.getJobQueue().size()).isZero();
        }
    }

    @Nested
    @DisplayName("Rate limiting")
    class RateLimitTests {

        @Test
        @DisplayName("should answer 429 once the burst is spent")
        void shouldRejectAfterBurst() throws Exception {
            int rejected = 0;
            for (int i = 0; i < 30; i++) {
                HttpResponse<String> response = get("/api/whoami", null);
                if (response.statusCode() == 429) {
                    rejected++;
                    assertThat(json(response).get("error").asText()).isEqualTo("Too Many Requests");
                }
            }
            assertThat(rejected).isPositive();
        }

        @Test
        @DisplayName("authenticated callers should get their own bucket")
        void shouldKeyBySubject() throws Exception {
            for (int i = 0; i < 30; i++) {
                get("/api/whoami", null);
            }

            HttpResponse<String> response = get("/api/whoami", token(TEST_SECRET, "bob", "read"));

            assertThat(response.statusCode()).isEqualTo(200);
        }

        @Test
        @DisplayName("disabling the limiter through a reload should lift the limit")
        void reloadShouldReplaceLimiter() throws Exception {
            for (int i = 0; i < 30; i++) {
                get("/api/whoami", null);
            }
            ApiServerConfig current = factory.getReloadLoop().currentConfig();
            factory.setConfig(current.withRateLimit(ApiServerConfig.RateLimitConfig.defaults()));

            assertThat(post("/admin/reload", token(TEST_SECRET, "root", "admin")).statusCode()).isEqualTo(200);

            for (int i = 0; i < 30; i++) {
                assertThat(get("/api/whoami", null).statusCode()).isEqualTo(200);
            }
            assertThat(factory.getLimiter().read().isEnabled()).isFalse();
        }
    }
}
