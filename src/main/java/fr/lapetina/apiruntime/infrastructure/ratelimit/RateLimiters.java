package fr.lapetina.apiruntime.infrastructure.ratelimit;

import fr.lapetina.apiruntime.domain.ratelimit.RateLimiterManager;
import fr.lapetina.apiruntime.infrastructure.config.ApiServerConfig;

/**
 * Factory for the rate limiter described by the {@code rateLimit} configuration section.
 */
public final class RateLimiters {

    private RateLimiters() {
    }

    public static RateLimiterManager fromConfig(ApiServerConfig.RateLimitConfig config) {
        return RateLimiterManager.fromConfig(
                config.enabled(),
                config.perIp(),
                config.perUser(),
                config.ratePerSec(),
                config.burst(),
                config.exemptPaths()
        );
    }
}
