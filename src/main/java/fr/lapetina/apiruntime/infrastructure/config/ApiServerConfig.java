package fr.lapetina.apiruntime.infrastructure.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Root configuration snapshot.
 *
 * Immutable and value-comparable: the reload loop detects changes with
 * {@link #equals(Object)}, section by section. Missing YAML keys fall back to
 * the defaults below.
 */
public record ApiServerConfig(
        ServerConfig server,
        LoggingConfig logging,
        RateLimitConfig rateLimit,
        AuthConfig auth,
        ReloadConfig reload,
        MetricsConfig metrics
) {
    public ApiServerConfig {
        server = server != null ? server : ServerConfig.defaults();
        logging = logging != null ? logging : LoggingConfig.defaults();
        rateLimit = rateLimit != null ? rateLimit : RateLimitConfig.defaults();
        auth = auth != null ? auth : AuthConfig.empty();
        reload = reload != null ? reload : ReloadConfig.defaults();
        metrics = metrics != null ? metrics : MetricsConfig.defaults();
    }

    public static ApiServerConfig defaults() {
        return new ApiServerConfig(null, null, null, null, null, null);
    }

    public ApiServerConfig withServer(ServerConfig server) {
        return new ApiServerConfig(server, logging, rateLimit, auth, reload, metrics);
    }

    public ApiServerConfig withLogging(LoggingConfig logging) {
        return new ApiServerConfig(server, logging, rateLimit, auth, reload, metrics);
    }

    public ApiServerConfig withRateLimit(RateLimitConfig rateLimit) {
        return new ApiServerConfig(server, logging, rateLimit, auth, reload, metrics);
    }

    public ApiServerConfig withAuth(AuthConfig auth) {
        return new ApiServerConfig(server, logging, rateLimit, auth, reload, metrics);
    }

    public ApiServerConfig withReload(ReloadConfig reload) {
        return new ApiServerConfig(server, logging, rateLimit, auth, reload, metrics);
    }

    /**
     * Copy with secret key material masked, for notifications and logs.
     */
    public ApiServerConfig redacted() {
        return withAuth(auth.redacted());
    }

    /**
     * HTTP listener settings.
     */
    public record ServerConfig(String host, int port, int backlog) {

        @JsonCreator
        public static ServerConfig of(
                @JsonProperty("host") String host,
                @JsonProperty("port") Integer port,
                @JsonProperty("backlog") Integer backlog
        ) {
            return new ServerConfig(
                    host != null ? host : "0.0.0.0",
                    port != null ? port : 6000,
                    backlog != null ? backlog : 100
            );
        }

        public static ServerConfig defaults() {
            return of(null, null, null);
        }
    }

    /**
     * Log verbosity and audit sink destination.
     *
     * @param level  a level name ({@code info}) or directives ({@code warn,fr.lapetina=debug})
     * @param logDir directory of the audit log file; null selects the SLF4J audit sink
     */
    public record LoggingConfig(String level, String logDir) {

        @JsonCreator
        public static LoggingConfig of(
                @JsonProperty("level") String level,
                @JsonProperty("logDir") String logDir
        ) {
            return new LoggingConfig(level != null ? level : "info", logDir);
        }

        public static LoggingConfig defaults() {
            return of(null, null);
        }
    }

    /**
     * Request rate limiting.
     *
     * @param sweepIntervalMs how often idle buckets are evicted
     * @param idleMultiplier  buckets idle for longer than this many refill windows are evicted
     */
    public record RateLimitConfig(
            boolean enabled,
            boolean perIp,
            boolean perUser,
            double ratePerSec,
            int burst,
            List<String> exemptPaths,
            long sweepIntervalMs,
            double idleMultiplier
    ) {
        public static final List<String> DEFAULT_EXEMPT_PATHS = List.of("/health", "/ready", "/csrf-token");

        public RateLimitConfig {
            exemptPaths = exemptPaths != null ? List.copyOf(exemptPaths) : List.of();
        }

        @JsonCreator
        public static RateLimitConfig of(
                @JsonProperty("enabled") Boolean enabled,
                @JsonProperty("perIp") Boolean perIp,
                @JsonProperty("perUser") Boolean perUser,
                @JsonProperty("ratePerSec") Double ratePerSec,
                @JsonProperty("burst") Integer burst,
                @JsonProperty("exemptPaths") List<String> exemptPaths,
                @JsonProperty("sweepIntervalMs") Long sweepIntervalMs,
                @JsonProperty("idleMultiplier") Double idleMultiplier
        ) {
            return new RateLimitConfig(
                    enabled != null ? enabled : false,
                    perIp != null ? perIp : true,
                    perUser != null ? perUser : true,
                    ratePerSec != null ? ratePerSec : 100.0,
                    burst != null ? burst : 200,
                    exemptPaths != null ? exemptPaths : DEFAULT_EXEMPT_PATHS,
                    sweepIntervalMs != null ? sweepIntervalMs : 60_000L,
                    idleMultiplier != null ? idleMultiplier : 2.0
            );
        }

        public static RateLimitConfig defaults() {
            return of(null, null, null, null, null, null, null, null);
        }
    }

    /**
     * Token verification key material. The first populated option wins, in
     * declaration order: inline PEM, PEM file path, shared secret.
     */
    public record AuthConfig(String jwtPem, String jwtPemPath, String jwtSecret) {

        private static final String MASK = "***";

        @JsonCreator
        public static AuthConfig of(
                @JsonProperty("jwtPem") String jwtPem,
                @JsonProperty("jwtPemPath") String jwtPemPath,
                @JsonProperty("jwtSecret") String jwtSecret
        ) {
            return new AuthConfig(jwtPem, jwtPemPath, jwtSecret);
        }

        public static AuthConfig empty() {
            return new AuthConfig(null, null, null);
        }

        public AuthConfig redacted() {
            return new AuthConfig(
                    jwtPem != null ? MASK : null,
                    jwtPemPath,
                    jwtSecret != null ? MASK : null
            );
        }

        @Override
        public String toString() {
            return "AuthConfig{" +
                    "jwtPem=" + (jwtPem != null ? MASK : null) +
                    ", jwtPemPath=" + jwtPemPath +
                    ", jwtSecret=" + (jwtSecret != null ? MASK : null) +
                    '}';
        }
    }

    /**
     * Periodic configuration reload.
     */
    public record ReloadConfig(boolean enabled, long intervalMs) {

        @JsonCreator
        public static ReloadConfig of(
                @JsonProperty("enabled") Boolean enabled,
                @JsonProperty("intervalMs") Long intervalMs
        ) {
            return new ReloadConfig(
                    enabled != null ? enabled : false,
                    intervalMs != null ? intervalMs : 86_400_000L
            );
        }

        public static ReloadConfig defaults() {
            return of(null, null);
        }
    }

    /**
     * Metrics configuration.
     */
    public record MetricsConfig(boolean enabled, String prefix) {

        public MetricsConfig {
            Objects.requireNonNull(prefix, "Metrics prefix is required");
        }

        @JsonCreator
        public static MetricsConfig of(
                @JsonProperty("enabled") Boolean enabled,
                @JsonProperty("prefix") String prefix
        ) {
            return new MetricsConfig(
                    enabled != null ? enabled : true,
                    prefix != null ? prefix : "api_runtime"
            );
        }

        public static MetricsConfig defaults() {
            return of(null, null);
        }
    }
}
