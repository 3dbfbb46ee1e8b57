package fr.lapetina.apiruntime.infrastructure.ratelimit;

import fr.lapetina.apiruntime.domain.ratelimit.RateLimiterManager;
import fr.lapetina.apiruntime.domain.swap.ComponentCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background task evicting idle buckets from the installed rate limiter.
 *
 * Always works on whatever limiter the cell holds at the time of the sweep, so
 * a limiter replaced by a reload needs no extra bookkeeping. A bucket is evicted
 * once it has been idle for {@code idleMultiplier} refill windows: it would be
 * full again by then, so dropping it does not change any decision.
 *
 * The interval and multiplier can be changed while running with
 * {@link #reconfigure(Duration, double)}.
 */
public final class BucketSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BucketSweeper.class);

    private final ComponentCell<RateLimiterManager> limiter;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Duration sweepInterval;
    private volatile double idleMultiplier;

    // Guarded by this
    private ScheduledFuture<?> scheduled;

    public BucketSweeper(ComponentCell<RateLimiterManager> limiter, Duration sweepInterval, double idleMultiplier) {
        checkSettings(sweepInterval, idleMultiplier);
        this.limiter = limiter;
        this.sweepInterval = sweepInterval;
        this.idleMultiplier = idleMultiplier;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bucket-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    private static void checkSettings(Duration sweepInterval, double idleMultiplier) {
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive: " + sweepInterval);
        }
        if (idleMultiplier < 1.0) {
            throw new IllegalArgumentException("idleMultiplier must be >= 1: " + idleMultiplier);
        }
    }

    /**
     * Starts the periodic sweep.
     */
    public synchronized void start() {
        if (running.compareAndSet(false, true)) {
            schedule();
            log.info("Bucket sweeper started with interval: {}", sweepInterval);
        }
    }

    private void schedule() {
        long millis = sweepInterval.toMillis();
        scheduled = scheduler.scheduleWithFixedDelay(this::scheduledSweep, millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Applies new sweep settings. A running sweeper is rescheduled when the interval changes.
     *
     * @throws IllegalArgumentException if the interval is not positive or the multiplier is below 1
     */
    public synchronized void reconfigure(Duration newInterval, double newMultiplier) {
        checkSettings(newInterval, newMultiplier);
        boolean intervalChanged = !newInterval.equals(sweepInterval);
        this.idleMultiplier = newMultiplier;
        this.sweepInterval = newInterval;
        if (intervalChanged && running.get() && !scheduler.isShutdown()) {
            scheduled.cancel(false);
            schedule();
        }
        log.info("Bucket sweeper reconfigured: interval={}, idleMultiplier={}", newInterval, newMultiplier);
    }

    private void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Bucket sweep failed: error={}", e.getMessage(), e);
        }
    }

    /**
     * Sweeps the current limiter once.
     *
     * @return number of buckets evicted
     */
    public int sweep() {
        RateLimiterManager manager = limiter.read();
        if (!manager.isEnabled()) {
            return 0;
        }
        Duration threshold = idleThreshold(manager);
        int removed = manager.evictIdle(threshold);
        log.debug("Bucket sweep finished: removed={}, remaining={}, idleThreshold={}",
                removed, manager.bucketCount(), threshold);
        return removed;
    }

    Duration idleThreshold(RateLimiterManager manager) {
        long nanos = (long) (manager.refillWindow().toNanos() * idleMultiplier);
        return Duration.ofNanos(nanos);
    }

    public boolean isRunning() {
        return running.get();
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public double getIdleMultiplier() {
        return idleMultiplier;
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Bucket sweeper stopped");
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
