package fr.lapetina.apiruntime.infrastructure.reload;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.apiruntime.domain.auth.TokenVerifier;
import fr.lapetina.apiruntime.domain.ratelimit.RateLimiterManager;
import fr.lapetina.apiruntime.domain.swap.ComponentCell;
import fr.lapetina.apiruntime.infrastructure.audit.AuditSink;
import fr.lapetina.apiruntime.infrastructure.audit.AuditSinks;
import fr.lapetina.apiruntime.infrastructure.config.ApiServerConfig;
import fr.lapetina.apiruntime.infrastructure.config.ConfigChangeListener;
import fr.lapetina.apiruntime.infrastructure.config.ConfigSource;
import fr.lapetina.apiruntime.infrastructure.config.ConfigValidator;
import fr.lapetina.apiruntime.infrastructure.config.StandardConfigValidator;
import fr.lapetina.apiruntime.infrastructure.jobs.JobRequest;
import fr.lapetina.apiruntime.infrastructure.keys.KeyMaterialResolver;
import fr.lapetina.apiruntime.infrastructure.keys.ResolvedKey;
import fr.lapetina.apiruntime.infrastructure.logging.LogLevelReloader;
import fr.lapetina.apiruntime.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.apiruntime.infrastructure.ratelimit.RateLimiters;
import fr.lapetina.apiruntime.infrastructure.state.RuntimeState;
import fr.lapetina.apiruntime.infrastructure.state.UpdateCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Periodically reloads the configuration and hot-swaps the affected components.
 *
 * Each cycle loads a fresh value, validates it and compares it with the current
 * one. When it differs, the new value is published first, then only the
 * components whose section changed are rebuilt:
 * <ul>
 *     <li>{@code logging.level}: the log level reloader is called</li>
 *     <li>{@code logging.logDir}: a new audit sink is installed</li>
 *     <li>{@code auth}: a new token verifier is resolved and installed; on failure
 *     the previous verifier stays in place</li>
 * </ul>
 * The rate limiter is rebuilt on every change, which resets all quotas. A change to
 * the {@code reload} section starts, stops or reschedules this loop. Changes to
 * {@code server} and {@code metrics} are published but only take effect after a
 * restart. Finally a
 * {@value #RELOAD_JOB_TYPE} job carrying the old and new values (secrets masked)
 * is enqueued, best effort.
 *
 * A load or validation failure leaves everything untouched. A failure while
 * reloading one component never prevents the others from being reloaded.
 * Cycles are serialized through the state's {@link UpdateCoordinator}.
 */
public final class ConfigReloadLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigReloadLoop.class);

    public static final String RELOAD_JOB_TYPE = "config.reload";

    static final String COMPONENT_VERIFIER = "verifier";
    static final String COMPONENT_AUDIT_SINK = "audit-sink";
    static final String COMPONENT_RATE_LIMITER = "rate-limiter";
    static final String COMPONENT_LOG_LEVEL = "log-level";

    private final ConfigSource source;
    private final ConfigValidator validator;
    private final RuntimeState state;
    private final ComponentCell<RateLimiterManager> limiter;
    private final KeyMaterialResolver keyResolver;
    private final Function<ApiServerConfig.LoggingConfig, AuditSink> auditSinkFactory;
    private final LogLevelReloader logLevelReloader;
    private final MetricsRegistry metrics;
    private final ComponentCell<ApiServerConfig> config;
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Duration interval;

    // Guarded by this
    private ScheduledFuture<?> scheduled;

    private ConfigReloadLoop(Builder builder) {
        this.source = Objects.requireNonNull(builder.source, "Config source is required");
        this.state = Objects.requireNonNull(builder.state, "Runtime state is required");
        this.limiter = Objects.requireNonNull(builder.limiter, "Rate limiter cell is required");
        this.config = new ComponentCell<>("config",
                Objects.requireNonNull(builder.initialConfig, "Initial config is required"));
        this.validator = builder.validator;
        this.keyResolver = builder.keyResolver;
        this.auditSinkFactory = builder.auditSinkFactory;
        this.logLevelReloader = builder.logLevelReloader;
        this.metrics = builder.metricsRegistry;
        this.interval = checkInterval(builder.interval);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-reloader");
            t.setDaemon(true);
            return t;
        });
    }

    private static Duration checkInterval(Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Reload interval must be positive: " + interval);
        }
        return interval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the periodic reload. The first cycle runs one interval from now.
     */
    public synchronized void start() {
        if (scheduler.isShutdown()) {
            return;
        }
        if (running.compareAndSet(false, true)) {
            schedule();
            log.info("Config reload loop started with interval: {}", interval);
        }
    }

    private void schedule() {
        long millis = interval.toMillis();
        scheduled = scheduler.scheduleWithFixedDelay(this::scheduledCycle, millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops the periodic reload without closing the loop. {@link #runCycle()} still works.
     */
    public synchronized void stop() {
        if (running.compareAndSet(true, false)) {
            scheduled.cancel(false);
            log.info("Config reload loop stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * The configuration currently in effect.
     */
    public ApiServerConfig currentConfig() {
        return config.read();
    }

    /**
     * Registers a listener called after every applied change.
     */
    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    private void scheduledCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            // Keep the schedule alive
            log.error("Unexpected error in config reload cycle: error={}", e.getMessage(), e);
        }
    }

    /**
     * Runs one load-validate-diff-apply cycle now, on the calling thread.
     */
    public ReloadOutcome runCycle() {
        long start = System.nanoTime();
        UpdateCoordinator updates = state.updates();
        ReloadOutcome outcome;
        if (!updates.tryBegin()) {
            log.info("Config reload skipped: another update is in progress");
            outcome = ReloadOutcome.BUSY;
        } else {
            try {
                outcome = reload();
            } finally {
                updates.end();
            }
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        if (metrics != null) {
            metrics.recordReloadCycle(outcome, elapsed);
        }
        log.debug("Config reload cycle finished: outcome={}, durationMs={}", outcome, elapsed.toMillis());
        return outcome;
    }

    private ReloadOutcome reload() {
        ApiServerConfig loaded;
        try {
            loaded = source.load();
        } catch (RuntimeException e) {
            log.error("Failed to reload configuration: error={}", e.getMessage(), e);
            return ReloadOutcome.LOAD_FAILED;
        }

        try {
            validator.validate(loaded);
        } catch (RuntimeException e) {
            log.error("Loaded configuration failed validation, ignoring: error={}", e.getMessage());
            return ReloadOutcome.INVALID;
        }

        ApiServerConfig old = config.read();
        if (old.equals(loaded)) {
            log.debug("Configuration unchanged");
            return ReloadOutcome.UNCHANGED;
        }

        config.swap(loaded);
        log.info("Configuration changed, reloading runtime components");

        reloadLogLevel(old, loaded);
        reloadAuditSink(old, loaded);
        reloadVerifier(old, loaded);
        reloadRateLimiter(loaded);
        reloadSchedule(old, loaded);
        warnRestartOnly(old, loaded);
        notifyListeners(old, loaded);
        enqueueReloadJob(old, loaded);

        return ReloadOutcome.APPLIED;
    }

    private void reloadLogLevel(ApiServerConfig old, ApiServerConfig updated) {
        String level = updated.logging().level();
        if (logLevelReloader == null || Objects.equals(old.logging().level(), level)) {
            return;
        }
        try {
            logLevelReloader.reload(level);
            countSwap(COMPONENT_LOG_LEVEL);
            log.info("Log level updated at runtime: newLevel={}", level);
        } catch (RuntimeException e) {
            log.error("Failed to reload log level: newLevel={}, error={}", level, e.getMessage());
        }
    }

    private void reloadAuditSink(ApiServerConfig old, ApiServerConfig updated) {
        if (Objects.equals(old.logging().logDir(), updated.logging().logDir())) {
            return;
        }
        try {
            AuditSink sink = auditSinkFactory.apply(updated.logging());
            AuditSink previous = state.swapAuditSink(sink);
            countSwap(COMPONENT_AUDIT_SINK);
            log.info("Swapped audit sink at runtime: previous={}, current={}", previous.describe(), sink.describe());
        } catch (RuntimeException e) {
            log.error("Failed to build audit sink, keeping existing sink: error={}", e.getMessage());
        }
    }

    private void reloadVerifier(ApiServerConfig old, ApiServerConfig updated) {
        if (old.auth().equals(updated.auth())) {
            return;
        }
        try {
            ResolvedKey resolved = keyResolver.resolve(updated.auth());
            TokenVerifier previous = state.swapVerifier(resolved.verifier());
            countSwap(COMPONENT_VERIFIER);
            log.info("Swapped token verifier at runtime: previous={}, current={}",
                    previous, resolved.descriptor().label());
        } catch (RuntimeException e) {
            log.error("New token verifier failed to build, leaving existing verifier in place: error={}",
                    e.getMessage());
        }
    }

    private void reloadRateLimiter(ApiServerConfig updated) {
        try {
            RateLimiterManager replacement = RateLimiters.fromConfig(updated.rateLimit());
            RateLimiterManager previous = limiter.swap(replacement);
            countSwap(COMPONENT_RATE_LIMITER);
            log.info("Rate limiter configuration reloaded: droppedBuckets={}, limiter={}",
                    previous.bucketCount(), replacement);
        } catch (RuntimeException e) {
            log.error("Failed to rebuild rate limiter, keeping existing limiter: error={}", e.getMessage());
        }
    }

    private synchronized void reloadSchedule(ApiServerConfig old, ApiServerConfig updated) {
        ApiServerConfig.ReloadConfig reload = updated.reload();
        if (old.reload().equals(reload) || scheduler.isShutdown()) {
            return;
        }
        if (!reload.enabled()) {
            stop();
            return;
        }
        Duration newInterval = checkInterval(Duration.ofMillis(reload.intervalMs()));
        if (running.get() && !newInterval.equals(interval)) {
            interval = newInterval;
            scheduled.cancel(false);
            schedule();
            log.info("Config reload loop rescheduled: interval={}", newInterval);
        } else {
            interval = newInterval;
            start();
        }
    }

    private void warnRestartOnly(ApiServerConfig old, ApiServerConfig updated) {
        if (!old.server().equals(updated.server())) {
            log.warn("Server settings changed, restart required to apply: server={}", updated.server());
        }
        if (!old.metrics().equals(updated.metrics())) {
            log.warn("Metrics settings changed, restart required to apply: metrics={}", updated.metrics());
        }
    }

    private void notifyListeners(ApiServerConfig old, ApiServerConfig updated) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(old, updated);
            } catch (RuntimeException e) {
                log.error("Config change listener failed: listener={}, error={}", listener, e.getMessage(), e);
            }
        }
    }

    private void enqueueReloadJob(ApiServerConfig old, ApiServerConfig updated) {
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.set("old", objectMapper.valueToTree(old.redacted()));
            payload.set("new", objectMapper.valueToTree(updated.redacted()));
            JobRequest job = JobRequest.of(RELOAD_JOB_TYPE, payload);
            state.jobQueue().enqueue(job).whenComplete((jobId, ex) -> {
                if (ex != null) {
                    log.warn("Config reload job was not accepted: jobId={}, error={}", job.id(), ex.getMessage());
                } else {
                    log.debug("Config reload job enqueued: jobId={}", jobId);
                }
            });
        } catch (RuntimeException e) {
            log.warn("Failed to enqueue config reload job: error={}", e.getMessage());
        }
    }

    private void countSwap(String component) {
        if (metrics != null) {
            metrics.incrementComponentSwap(component);
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            if (running.compareAndSet(true, false)) {
                log.info("Config reload loop stopping");
            }
            scheduler.shutdown();
        }
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Builder for ConfigReloadLoop.
     */
    public static final class Builder {
        private ConfigSource source;
        private ConfigValidator validator = new StandardConfigValidator();
        private RuntimeState state;
        private ComponentCell<RateLimiterManager> limiter;
        private KeyMaterialResolver keyResolver = new KeyMaterialResolver();
        private Function<ApiServerConfig.LoggingConfig, AuditSink> auditSinkFactory = AuditSinks::fromConfig;
        private LogLevelReloader logLevelReloader;
        private MetricsRegistry metricsRegistry;
        private Duration interval = Duration.ofDays(1);
        private ApiServerConfig initialConfig;

        public Builder source(ConfigSource source) {
            this.source = source;
            return this;
        }

        public Builder validator(ConfigValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder state(RuntimeState state) {
            this.state = state;
            return this;
        }

        public Builder limiter(ComponentCell<RateLimiterManager> limiter) {
            this.limiter = limiter;
            return this;
        }

        public Builder keyResolver(KeyMaterialResolver resolver) {
            this.keyResolver = resolver;
            return this;
        }

        public Builder auditSinkFactory(Function<ApiServerConfig.LoggingConfig, AuditSink> factory) {
            this.auditSinkFactory = factory;
            return this;
        }

        public Builder logLevelReloader(LogLevelReloader reloader) {
            this.logLevelReloader = reloader;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder initialConfig(ApiServerConfig config) {
            this.initialConfig = config;
            return this;
        }

        public Builder fromConfig(ApiServerConfig config) {
            this.initialConfig = config;
            this.interval = Duration.ofMillis(config.reload().intervalMs());
            return this;
        }

        public ConfigReloadLoop build() {
            return new ConfigReloadLoop(this);
        }
    }
}
