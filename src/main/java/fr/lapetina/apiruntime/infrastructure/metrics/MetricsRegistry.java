package fr.lapetina.apiruntime.infrastructure.metrics;

import fr.lapetina.apiruntime.infrastructure.reload.ReloadOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Reload cycle counters by outcome, and cycle duration
 * - Component swap counters by component
 * - Rate-limit decision counters
 * - Live bucket gauge
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DECISION_ALLOWED = "allowed";
    public static final String DECISION_REJECTED = "rejected";
    public static final String DECISION_EXEMPT = "exempt";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<ReloadOutcome, Counter> reloadCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> swapCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> decisionCounters = new ConcurrentHashMap<>();
    private final Timer reloadTimer;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.reloadTimer = Timer.builder(prefix + "_config_reload_duration")
                .description("Duration of configuration reload cycles")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("api_runtime");
    }

    /**
     * Counts one reload cycle and records how long it took.
     */
    public void recordReloadCycle(ReloadOutcome outcome, Duration duration) {
        reloadCounters.computeIfAbsent(outcome, o ->
                Counter.builder(prefix + "_config_reload_cycles_total")
                        .description("Configuration reload cycles by outcome")
                        .tag("outcome", o.name().toLowerCase(Locale.ROOT))
                        .register(registry)
        ).increment();
        reloadTimer.record(duration);
    }

    /**
     * Counts a hot swap of a runtime component.
     */
    public void incrementComponentSwap(String component) {
        swapCounters.computeIfAbsent(component, c ->
                Counter.builder(prefix + "_component_swaps_total")
                        .description("Runtime component replacements")
                        .tag("component", c)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a rate limiter decision: {@link #DECISION_ALLOWED},
     * {@link #DECISION_REJECTED} or {@link #DECISION_EXEMPT}.
     */
    public void incrementRateLimitDecision(String decision) {
        decisionCounters.computeIfAbsent(decision, d ->
                Counter.builder(prefix + "_rate_limit_decisions_total")
                        .description("Rate limiter decisions")
                        .tag("decision", d)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for the number of live rate-limit buckets.
     */
    public void registerBucketGauge(Supplier<Number> bucketCount) {
        Gauge.builder(prefix + "_rate_limit_buckets", bucketCount, s -> s.get().doubleValue())
                .description("Live rate-limit buckets in the installed limiter")
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
