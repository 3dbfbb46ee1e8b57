package fr.lapetina.apiruntime.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.apiruntime.domain.auth.AuthenticationException;
import fr.lapetina.apiruntime.domain.model.AuthContext;
import fr.lapetina.apiruntime.domain.model.KeyDescriptor;
import fr.lapetina.apiruntime.domain.ratelimit.RateLimiterManager;
import fr.lapetina.apiruntime.domain.swap.ComponentCell;
import fr.lapetina.apiruntime.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.apiruntime.infrastructure.reload.ConfigReloadLoop;
import fr.lapetina.apiruntime.infrastructure.reload.ReloadOutcome;
import fr.lapetina.apiruntime.infrastructure.state.RuntimeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /health - Liveness check
 * - GET /metrics - Prometheus metrics endpoint, when metrics are enabled
 * - GET /api/whoami - Authenticated caller as seen by the current verifier
 * - GET /admin/runtime - Current configuration (secrets masked), key and limiter state
 * - POST /admin/reload - Run one configuration reload cycle now
 *
 * Every context goes through {@link RateLimitFilter}. Admin endpoints require
 * the {@code admin} scope.
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final int DEFAULT_WORKER_THREADS = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final RuntimeState state;
    private final ComponentCell<RateLimiterManager> limiter;
    private final ConfigReloadLoop reloadLoop;
    private final MetricsRegistry metricsRegistry;
    private final Instant startedAt = Instant.now();

    public HttpServer(
            String host,
            int port,
            int backlog,
            RuntimeState state,
            ComponentCell<RateLimiterManager> limiter,
            ConfigReloadLoop reloadLoop,
            MetricsRegistry metricsRegistry,
            boolean exposeMetrics
    ) throws IOException {
        this.state = state;
        this.limiter = limiter;
        this.reloadLoop = reloadLoop;
        this.metricsRegistry = metricsRegistry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(DEFAULT_WORKER_THREADS, r -> {
            Thread t = new Thread(r, "http-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        RateLimitFilter rateLimitFilter = new RateLimitFilter(limiter, state, metricsRegistry);
        register("/health", new HealthHandler(), rateLimitFilter);
        if (exposeMetrics) {
            register("/metrics", new MetricsHandler(), rateLimitFilter);
        }
        register("/api", new ApiHandler(), rateLimitFilter);
        register("/admin", new AdminHandler(), rateLimitFilter);

        log.info("HTTP server configured on {}:{}", host, getPort());
    }

    private void register(String path, HttpHandler handler, RateLimitFilter filter) {
        HttpContext context = server.createContext(path, handler);
        context.getFilters().add(filter);
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * The bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("timestamp", System.currentTimeMillis());
            sendJson(exchange, 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== API HANDLER ====================

    private class ApiHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                state.audit(method, path, Map.of(), queryParams(exchange), null);

                if (path.equals("/api/whoami") && "GET".equals(method)) {
                    AuthContext caller = authenticate(exchange);
                    if (caller == null) {
                        return;
                    }
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("subject", caller.subject());
                    body.put("scopes", caller.scopes());
                    body.put("authenticated", caller.isAuthenticated());
                    sendJson(exchange, 200, body);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error handling API request: path={}", path, e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                state.audit(method, path, Map.of(), queryParams(exchange), null);

                AuthContext caller = authenticate(exchange);
                if (caller == null) {
                    return;
                }
                if (!caller.isAdmin()) {
                    sendError(exchange, 403, "Forbidden");
                    return;
                }

                if (path.equals("/admin/runtime") && "GET".equals(method)) {
                    handleRuntime(exchange);
                } else if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReload(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleRuntime(HttpExchange exchange) throws IOException {
            Map<String, Object> runtime = new LinkedHashMap<>();
            runtime.put("startedAt", startedAt);
            runtime.put("config", reloadLoop.currentConfig().redacted());
            runtime.put("reloadRunning", reloadLoop.isRunning());
            runtime.put("updateInProgress", state.updates().isUpdating());

            KeyDescriptor key = state.verifier().keyDescriptor().orElse(null);
            if (key != null) {
                Map<String, Object> keyInfo = new LinkedHashMap<>();
                keyInfo.put("label", key.label());
                keyInfo.put("fingerprint", key.fingerprint());
                keyInfo.put("keyType", key.keyType());
                keyInfo.put("bits", key.bitLength());
                runtime.put("key", keyInfo);
            }

            RateLimiterManager manager = limiter.read();
            Map<String, Object> limiterInfo = new LinkedHashMap<>();
            limiterInfo.put("enabled", manager.isEnabled());
            limiterInfo.put("ratePerSec", manager.getRatePerSec());
            limiterInfo.put("burst", manager.getBurst());
            limiterInfo.put("buckets", manager.bucketCount());
            runtime.put("rateLimiter", limiterInfo);

            runtime.put("auditSink", state.auditSink().describe());
            sendJson(exchange, 200, runtime);
        }

        private void handleReload(HttpExchange exchange) throws IOException {
            ReloadOutcome outcome = reloadLoop.runCycle();
            log.info("Manual config reload requested: outcome={}", outcome);
            int status = switch (outcome) {
                case BUSY -> 409;
                case LOAD_FAILED, INVALID -> 422;
                case UNCHANGED, APPLIED -> 200;
            };
            sendJson(exchange, status, Map.of("outcome", outcome.name()));
        }
    }

    // ==================== HELPER METHODS ====================

    /**
     * Authenticates the caller with the verifier installed right now.
     * Sends a 401 and returns null when a presented token is rejected.
     */
    private AuthContext authenticate(HttpExchange exchange) throws IOException {
        String authorization = exchange.getRequestHeaders().getFirst("Authorization");
        try {
            return state.verifier().authenticate(authorization);
        } catch (AuthenticationException e) {
            log.debug("Authentication failed: reason={}", e.getReason());
            sendError(exchange, 401, e.getMessage());
            return null;
        }
    }

    private static Map<String, String> queryParams(HttpExchange exchange) {
        Map<String, String> params = new LinkedHashMap<>();
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(name, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "error");
        sendJson(exchange, statusCode, error);
    }
}
