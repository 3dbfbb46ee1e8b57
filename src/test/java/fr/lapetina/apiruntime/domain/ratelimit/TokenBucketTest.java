package fr.lapetina.apiruntime.domain.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketTest {

    private final AtomicLong clock = new AtomicLong(1_000_000_000L);

    private TokenBucket bucket;

    @BeforeEach
    void setUp() {
        // capacity 2, one token per second
        bucket = new TokenBucket(2, 1.0, clock::get);
    }

    private void advanceMillis(long millis) {
        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    @Test
    @DisplayName("should start full and admit up to capacity")
    void shouldStartFull() {
        assertThat(bucket.availableTokens()).isEqualTo(2.0);
        assertThat(bucket.tryAcquire()).isTrue();
        assertThat(bucket.tryAcquire()).isTrue();
        assertThat(bucket.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("should refill continuously over time")
    void shouldRefillOverTime() {
        bucket.tryAcquire();
        bucket.tryAcquire();
        assertThat(bucket.tryAcquire()).isFalse();

        advanceMillis(500);
        assertThat(bucket.tryAcquire()).isFalse();

        advanceMillis(600);
        assertThat(bucket.tryAcquire()).isTrue();
        assertThat(bucket.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("should never exceed capacity after a long idle period")
    void shouldClampToCapacity() {
        advanceMillis(60_000);

        assertThat(bucket.tryAcquire()).isTrue();
        assertThat(bucket.tryAcquire()).isTrue();
        assertThat(bucket.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("should admit at most burst plus rate times elapsed")
    void shouldRespectBurstPlusRefillBound() {
        TokenBucket fast = new TokenBucket(10, 5.0, clock::get);
        int allowed = 0;
        // 3 seconds of attempts every 10ms
        for (int i = 0; i < 300; i++) {
            if (fast.tryAcquire()) {
                allowed++;
            }
            advanceMillis(10);
        }

        assertThat(allowed).isLessThanOrEqualTo(10 + (int) Math.ceil(5.0 * 3.0));
        assertThat(allowed).isGreaterThanOrEqualTo(10 + 14);
    }

    @Test
    @DisplayName("should admit nothing once drained when refill rate is zero")
    void shouldNotRefillWithZeroRate() {
        TokenBucket fixed = new TokenBucket(1, 0.0, clock::get);

        assertThat(fixed.tryAcquire()).isTrue();
        advanceMillis(10_000);
        assertThat(fixed.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("should never admit with zero capacity")
    void shouldRejectWithZeroCapacity() {
        TokenBucket empty = new TokenBucket(0, 100.0, clock::get);

        advanceMillis(1_000);

        assertThat(empty.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("should track idle time since last attempt")
    void shouldTrackIdleTime() {
        bucket.tryAcquire();
        advanceMillis(250);

        assertThat(bucket.idleNanos()).isEqualTo(TimeUnit.MILLISECONDS.toNanos(250));

        bucket.tryAcquire();
        assertThat(bucket.idleNanos()).isZero();
    }

    @Test
    @DisplayName("should reject negative settings")
    void shouldRejectNegativeSettings() {
        assertThatThrownBy(() -> new TokenBucket(-1, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucket(1, -1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
