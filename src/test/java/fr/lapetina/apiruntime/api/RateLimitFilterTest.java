package fr.lapetina.apiruntime.api;

import fr.lapetina.apiruntime.domain.ratelimit.RateLimiterManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitFilterTest {

    private static RateLimiterManager limiter(boolean perIp, boolean perUser) {
        return RateLimiterManager.fromConfig(true, perIp, perUser, 10.0, 10, List.of());
    }

    @Test
    @DisplayName("per-user limiting should key authenticated callers by subject")
    void shouldKeyBySubject() {
        assertThat(RateLimitFilter.deriveKey(limiter(true, true), "alice", "10.0.0.1")).isEqualTo("user:alice");
        assertThat(RateLimitFilter.deriveKey(limiter(false, true), "alice", "10.0.0.1")).isEqualTo("user:alice");
    }

    @Test
    @DisplayName("anonymous callers should fall back to the address")
    void shouldFallBackToAddress() {
        assertThat(RateLimitFilter.deriveKey(limiter(true, true), null, "10.0.0.1")).isEqualTo("ip:10.0.0.1");
        assertThat(RateLimitFilter.deriveKey(limiter(false, true), null, "10.0.0.1")).isEqualTo("ip:10.0.0.1");
    }

    @Test
    @DisplayName("per-address limiting should ignore the subject")
    void shouldIgnoreSubjectWhenPerIpOnly() {
        assertThat(RateLimitFilter.deriveKey(limiter(true, false), "alice", "10.0.0.1")).isEqualTo("ip:10.0.0.1");
    }

    @Test
    @DisplayName("without per-user or per-address limiting everyone shares one bucket")
    void shouldUseGlobalKey() {
        assertThat(RateLimitFilter.deriveKey(limiter(false, false), "alice", "10.0.0.1"))
                .isEqualTo(RateLimitFilter.GLOBAL_KEY);
    }
}
