package fr.lapetina.apiruntime.infrastructure.config;

import fr.lapetina.apiruntime.infrastructure.logging.LogLevelDirectives;

import java.util.regex.Pattern;

/**
 * Default semantic checks for {@link ApiServerConfig}.
 */
public final class StandardConfigValidator implements ConfigValidator {

    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:]*:[0-9a-fA-F:.]*$");
    private static final Pattern HOSTNAME = Pattern.compile(
            "^(?=.{1,253}$)[a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?(\\.[a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*$");

    @Override
    public void validate(ApiServerConfig config) {
        validateServer(config.server());
        validateLogging(config.logging());
        validateRateLimit(config.rateLimit());
        validateReload(config.reload());
    }

    private void validateServer(ApiServerConfig.ServerConfig server) {
        if (server.port() < 1 || server.port() > 65535) {
            throw new ConfigurationException("server.port must be between 1 and 65535: " + server.port());
        }
        String host = server.host();
        if (host == null || !(IPV4.matcher(host).matches()
                || IPV6.matcher(host).matches()
                || HOSTNAME.matcher(host).matches())) {
            throw new ConfigurationException("invalid server.host: " + host);
        }
        if (server.backlog() < 0) {
            throw new ConfigurationException("server.backlog must be >= 0: " + server.backlog());
        }
    }

    private void validateLogging(ApiServerConfig.LoggingConfig logging) {
        try {
            LogLevelDirectives.parse(logging.level());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid logging.level: " + e.getMessage(), e);
        }
        if (logging.logDir() != null && logging.logDir().isBlank()) {
            throw new ConfigurationException("logging.logDir must not be blank when set");
        }
    }

    private void validateRateLimit(ApiServerConfig.RateLimitConfig rateLimit) {
        if (Double.isNaN(rateLimit.ratePerSec()) || rateLimit.ratePerSec() < 0) {
            throw new ConfigurationException("rateLimit.ratePerSec must be >= 0: " + rateLimit.ratePerSec());
        }
        if (rateLimit.burst() < 0) {
            throw new ConfigurationException("rateLimit.burst must be >= 0: " + rateLimit.burst());
        }
        if (rateLimit.enabled()) {
            if (rateLimit.ratePerSec() <= 0) {
                throw new ConfigurationException("rateLimit.ratePerSec must be > 0 when rate limiting is enabled");
            }
            if (rateLimit.burst() < 1) {
                throw new ConfigurationException("rateLimit.burst must be >= 1 when rate limiting is enabled");
            }
        }
        if (rateLimit.sweepIntervalMs() <= 0) {
            throw new ConfigurationException("rateLimit.sweepIntervalMs must be > 0: " + rateLimit.sweepIntervalMs());
        }
        if (!(rateLimit.idleMultiplier() >= 1.0)) {
            throw new ConfigurationException("rateLimit.idleMultiplier must be >= 1: " + rateLimit.idleMultiplier());
        }
    }

    private void validateReload(ApiServerConfig.ReloadConfig reload) {
        if (reload.intervalMs() <= 0) {
            throw new ConfigurationException("reload.intervalMs must be > 0: " + reload.intervalMs());
        }
    }
}
