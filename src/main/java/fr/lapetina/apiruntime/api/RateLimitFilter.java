package fr.lapetina.apiruntime.api;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import fr.lapetina.apiruntime.domain.auth.AuthenticationException;
import fr.lapetina.apiruntime.domain.model.AuthContext;
import fr.lapetina.apiruntime.domain.ratelimit.RateLimiterManager;
import fr.lapetina.apiruntime.domain.swap.ComponentCell;
import fr.lapetina.apiruntime.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.apiruntime.infrastructure.state.RuntimeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Applies the installed rate limiter to every request of a context.
 *
 * The limiter is read once per request, so a request is judged entirely by
 * either the old or the new limiter during a reload.
 */
final class RateLimitFilter extends Filter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String GLOBAL_KEY = "global";

    private static final byte[] TOO_MANY_REQUESTS =
            "{\"error\":\"Too Many Requests\"}".getBytes(StandardCharsets.UTF_8);

    private final ComponentCell<RateLimiterManager> limiter;
    private final RuntimeState state;
    private final MetricsRegistry metrics;

    RateLimitFilter(ComponentCell<RateLimiterManager> limiter, RuntimeState state, MetricsRegistry metrics) {
        this.limiter = limiter;
        this.state = state;
        this.metrics = metrics;
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        RateLimiterManager manager = limiter.read();
        String path = exchange.getRequestURI().getPath();

        if (manager.isExempt(path)) {
            metrics.incrementRateLimitDecision(MetricsRegistry.DECISION_EXEMPT);
            chain.doFilter(exchange);
            return;
        }

        String key = deriveKey(manager, subjectOf(manager, exchange), addressOf(exchange));
        if (manager.tryAcquireFor(key)) {
            metrics.incrementRateLimitDecision(MetricsRegistry.DECISION_ALLOWED);
            chain.doFilter(exchange);
            return;
        }

        metrics.incrementRateLimitDecision(MetricsRegistry.DECISION_REJECTED);
        log.debug("Request rate limited: key={}, path={}", key, path);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(429, TOO_MANY_REQUESTS.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(TOO_MANY_REQUESTS);
        }
    }

    @Override
    public String description() {
        return "Per-key token bucket rate limiting";
    }

    /**
     * Bucket key for a request: the authenticated subject when limiting per user,
     * else the client address when limiting per user or per address, else one
     * key shared by everyone.
     */
    static String deriveKey(RateLimiterManager manager, String subject, String address) {
        if (manager.isPerUser() && subject != null) {
            return "user:" + subject;
        }
        if (manager.isPerUser() || manager.isPerIp()) {
            return "ip:" + address;
        }
        return GLOBAL_KEY;
    }

    private String subjectOf(RateLimiterManager manager, HttpExchange exchange) {
        if (!manager.isEnabled() || !manager.isPerUser()) {
            return null;
        }
        String authorization = exchange.getRequestHeaders().getFirst("Authorization");
        if (authorization == null) {
            return null;
        }
        try {
            AuthContext context = state.verifier().authenticate(authorization);
            return context.subject();
        } catch (AuthenticationException e) {
            // Rejected credentials are limited by address
            return null;
        }
    }

    private static String addressOf(HttpExchange exchange) {
        InetSocketAddress remote = exchange.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return "unknown";
        }
        return remote.getAddress().getHostAddress();
    }
}
