package fr.lapetina.apiruntime.domain.ratelimit;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Single-key token bucket.
 *
 * The bucket starts full and refills continuously at {@code refillPerSecond}
 * tokens per second, never exceeding its capacity. Refill is computed lazily
 * on each acquisition attempt.
 *
 * Thread-safe: the refill and the check-and-decrement run in one critical section.
 */
public final class TokenBucket {

    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final ReentrantLock lock = new ReentrantLock();
    private final LongSupplier nanoClock;
    private final double capacity;
    private final double refillPerSecond;

    // Guarded by lock
    private double tokens;
    private long lastRefill;

    private volatile long lastAccess;

    public TokenBucket(int capacity, double refillPerSecond) {
        this(capacity, refillPerSecond, System::nanoTime);
    }

    TokenBucket(int capacity, double refillPerSecond, LongSupplier nanoClock) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0: " + capacity);
        }
        if (refillPerSecond < 0 || Double.isNaN(refillPerSecond)) {
            throw new IllegalArgumentException("refillPerSecond must be >= 0: " + refillPerSecond);
        }
        this.nanoClock = nanoClock;
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.tokens = capacity;
        this.lastRefill = nanoClock.getAsLong();
        this.lastAccess = lastRefill;
    }

    /**
     * Attempts to take one token.
     *
     * @return true if the unit of work is allowed now
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            long now = nanoClock.getAsLong();
            lastAccess = now;
            long elapsed = now - lastRefill;
            if (elapsed > 0) {
                tokens = Math.min(capacity, tokens + (elapsed / NANOS_PER_SECOND) * refillPerSecond);
                lastRefill = now;
            }
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tokens currently available, without refilling.
     */
    public double availableTokens() {
        lock.lock();
        try {
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Nanoseconds elapsed since the last acquisition attempt.
     */
    public long idleNanos() {
        return Math.max(0, nanoClock.getAsLong() - lastAccess);
    }

    @Override
    public String toString() {
        return "TokenBucket{" +
                "capacity=" + capacity +
                ", refillPerSecond=" + refillPerSecond +
                ", tokens=" + availableTokens() +
                '}';
    }
}
