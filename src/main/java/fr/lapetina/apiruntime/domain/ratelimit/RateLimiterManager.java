package fr.lapetina.apiruntime.domain.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Owns one {@link TokenBucket} per distinguishing key (client address,
 * authenticated subject, ...) plus the static limiter settings.
 *
 * Buckets are created on first use of a key. A manager is never reconfigured
 * in place: a configuration reload builds a new manager with an empty bucket
 * map, so every key starts again at full capacity.
 *
 * The manager does not derive keys itself; callers decide which string to pass
 * and must check {@link #isExempt(String)} before calling {@link #tryAcquireFor(String)}.
 */
public final class RateLimiterManager {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterManager.class);

    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final boolean enabled;
    private final boolean perIp;
    private final boolean perUser;
    private final double ratePerSec;
    private final int burst;
    private final Set<String> exemptPaths;
    private final LongSupplier nanoClock;

    private RateLimiterManager(
            boolean enabled,
            boolean perIp,
            boolean perUser,
            double ratePerSec,
            int burst,
            List<String> exemptPaths,
            LongSupplier nanoClock
    ) {
        this.enabled = enabled;
        this.perIp = perIp;
        this.perUser = perUser;
        this.ratePerSec = ratePerSec;
        this.burst = burst;
        this.exemptPaths = exemptPaths != null ? Set.copyOf(exemptPaths) : Set.of();
        this.nanoClock = nanoClock;
    }

    public static RateLimiterManager fromConfig(
            boolean enabled,
            boolean perIp,
            boolean perUser,
            double ratePerSec,
            int burst,
            List<String> exemptPaths
    ) {
        return fromConfig(enabled, perIp, perUser, ratePerSec, burst, exemptPaths, System::nanoTime);
    }

    static RateLimiterManager fromConfig(
            boolean enabled,
            boolean perIp,
            boolean perUser,
            double ratePerSec,
            int burst,
            List<String> exemptPaths,
            LongSupplier nanoClock
    ) {
        RateLimiterManager manager = new RateLimiterManager(
                enabled, perIp, perUser, ratePerSec, burst, exemptPaths, nanoClock);
        log.debug("RateLimiterManager created: enabled={}, perIp={}, perUser={}, ratePerSec={}, burst={}, exemptPaths={}",
                enabled, perIp, perUser, ratePerSec, burst, manager.exemptPaths.size());
        return manager;
    }

    /**
     * A manager that admits everything.
     */
    public static RateLimiterManager disabled() {
        return fromConfig(false, false, false, 0.0, 0, List.of());
    }

    public boolean isExempt(String path) {
        return exemptPaths.contains(path);
    }

    /**
     * Takes one token from the bucket scoped to {@code key}, creating it on first use.
     * Always allows when the limiter is disabled, without touching any state.
     */
    public boolean tryAcquireFor(String key) {
        if (!enabled) {
            return true;
        }
        boolean[] allowed = new boolean[1];
        // Acquire inside compute so eviction of this key cannot interleave with it
        buckets.compute(key, (k, existing) -> {
            TokenBucket bucket = existing != null ? existing : new TokenBucket(burst, ratePerSec, nanoClock);
            allowed[0] = bucket.tryAcquire();
            return bucket;
        });
        return allowed[0];
    }

    /**
     * Removes buckets that have not been touched for longer than {@code maxIdle}.
     *
     * @return number of buckets removed
     */
    public int evictIdle(Duration maxIdle) {
        long maxIdleNanos = maxIdle.toNanos();
        int removed = 0;
        for (String key : buckets.keySet()) {
            boolean[] evicted = new boolean[1];
            buckets.computeIfPresent(key, (k, bucket) -> {
                if (bucket.idleNanos() > maxIdleNanos) {
                    evicted[0] = true;
                    return null;
                }
                return bucket;
            });
            if (evicted[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Evicted idle rate-limit buckets: removed={}, remaining={}", removed, buckets.size());
        }
        return removed;
    }

    /**
     * Time an empty bucket needs to refill completely.
     * A bucket idle for longer than this is full, so evicting it changes nothing.
     */
    public Duration refillWindow() {
        if (ratePerSec <= 0) {
            return Duration.ofDays(1);
        }
        return Duration.ofNanos((long) (burst / ratePerSec * 1_000_000_000L));
    }

    public int bucketCount() {
        return buckets.size();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isPerIp() {
        return perIp;
    }

    public boolean isPerUser() {
        return perUser;
    }

    public double getRatePerSec() {
        return ratePerSec;
    }

    public int getBurst() {
        return burst;
    }

    public Set<String> getExemptPaths() {
        return exemptPaths;
    }

    @Override
    public String toString() {
        return "RateLimiterManager{" +
                "enabled=" + enabled +
                ", perIp=" + perIp +
                ", perUser=" + perUser +
                ", ratePerSec=" + ratePerSec +
                ", burst=" + burst +
                ", buckets=" + buckets.size() +
                '}';
    }
}
