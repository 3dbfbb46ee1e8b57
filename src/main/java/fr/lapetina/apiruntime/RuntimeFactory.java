package fr.lapetina.apiruntime;

import fr.lapetina.apiruntime.domain.ratelimit.RateLimiterManager;
import fr.lapetina.apiruntime.domain.swap.ComponentCell;
import fr.lapetina.apiruntime.infrastructure.audit.AuditSinks;
import fr.lapetina.apiruntime.infrastructure.config.ApiServerConfig;
import fr.lapetina.apiruntime.infrastructure.config.ConfigLoader;
import fr.lapetina.apiruntime.infrastructure.config.ConfigSource;
import fr.lapetina.apiruntime.infrastructure.config.ConfigValidator;
import fr.lapetina.apiruntime.infrastructure.config.StandardConfigValidator;
import fr.lapetina.apiruntime.infrastructure.jobs.InMemoryJobQueue;
import fr.lapetina.apiruntime.infrastructure.jobs.JobQueueClient;
import fr.lapetina.apiruntime.infrastructure.jobs.JobWorker;
import fr.lapetina.apiruntime.infrastructure.keys.KeyMaterialResolver;
import fr.lapetina.apiruntime.infrastructure.keys.ResolvedKey;
import fr.lapetina.apiruntime.infrastructure.logging.LogLevelReloader;
import fr.lapetina.apiruntime.infrastructure.logging.LogbackLevelReloader;
import fr.lapetina.apiruntime.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.apiruntime.infrastructure.ratelimit.BucketSweeper;
import fr.lapetina.apiruntime.infrastructure.ratelimit.RateLimiters;
import fr.lapetina.apiruntime.infrastructure.reload.ConfigReloadLoop;
import fr.lapetina.apiruntime.infrastructure.state.RuntimeState;
import fr.lapetina.apiruntime.infrastructure.state.UpdateCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Builds the fully-wired runtime from configuration.
 *
 * Startup is strict: a configuration that fails to load or validate, or key
 * material that cannot be resolved, aborts construction with a
 * {@link fr.lapetina.apiruntime.infrastructure.config.ConfigurationException}.
 * Later reloads are lenient and never stop the process.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RuntimeFactory runtime = RuntimeFactory.create("config.yaml").start()) {
 *     RuntimeState state = runtime.getState();
 *     // serve requests...
 * }
 * }</pre>
 */
public class RuntimeFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RuntimeFactory.class);

    private final ApiServerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final RuntimeState state;
    private final ComponentCell<RateLimiterManager> limiter;
    private final ConfigReloadLoop reloadLoop;
    private final BucketSweeper bucketSweeper;
    private final JobWorker jobWorker;

    protected RuntimeFactory(
            ConfigSource source,
            ConfigValidator validator,
            LogLevelReloader logLevelReloader,
            JobQueueClient jobQueue
    ) {
        // Load and validate configuration
        this.config = source.load();
        validator.validate(config);

        // Resolve key material
        KeyMaterialResolver keyResolver = new KeyMaterialResolver();
        ResolvedKey resolvedKey = keyResolver.resolve(config.auth());

        if (logLevelReloader != null) {
            logLevelReloader.reload(config.logging().level());
        }

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.metrics().prefix());

        // Shared state
        this.state = new RuntimeState(
                resolvedKey.verifier(),
                AuditSinks.fromConfig(config.logging()),
                jobQueue,
                new UpdateCoordinator()
        );

        this.limiter = new ComponentCell<>("rate-limiter", RateLimiters.fromConfig(config.rateLimit()));
        metricsRegistry.registerBucketGauge(() -> limiter.read().bucketCount());

        this.reloadLoop = ConfigReloadLoop.builder()
                .fromConfig(config)
                .source(source)
                .validator(validator)
                .state(state)
                .limiter(limiter)
                .keyResolver(keyResolver)
                .logLevelReloader(logLevelReloader)
                .metricsRegistry(metricsRegistry)
                .build();

        this.bucketSweeper = new BucketSweeper(
                limiter,
                Duration.ofMillis(config.rateLimit().sweepIntervalMs()),
                config.rateLimit().idleMultiplier()
        );
        reloadLoop.addListener((old, updated) -> {
            ApiServerConfig.RateLimitConfig rateLimit = updated.rateLimit();
            if (rateLimit.sweepIntervalMs() != old.rateLimit().sweepIntervalMs()
                    || rateLimit.idleMultiplier() != old.rateLimit().idleMultiplier()) {
                bucketSweeper.reconfigure(Duration.ofMillis(rateLimit.sweepIntervalMs()), rateLimit.idleMultiplier());
            }
        });

        // Other queue clients are drained by their own consumers
        this.jobWorker = jobQueue instanceof InMemoryJobQueue inMemory ? JobWorker.logging(inMemory) : null;

        log.info("RuntimeFactory initialized: key={}, auditSink={}, rateLimiter={}",
                resolvedKey.descriptor().label(), state.auditSink().describe(), limiter.read());
    }

    /**
     * Creates a runtime from the specified configuration file.
     */
    public static RuntimeFactory create(String configPath) {
        log.info("Initializing RuntimeFactory from config: {}", configPath);
        return new RuntimeFactory(
                new ConfigLoader(configPath),
                new StandardConfigValidator(),
                new LogbackLevelReloader(),
                new InMemoryJobQueue()
        );
    }

    /**
     * Creates a runtime from the default configuration (config.yaml).
     */
    public static RuntimeFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the bucket sweeper, the job worker and, when enabled, the periodic config reload.
     */
    public RuntimeFactory start() {
        bucketSweeper.start();
        if (jobWorker != null) {
            jobWorker.start();
        }
        if (reloadLoop.currentConfig().reload().enabled()) {
            reloadLoop.start();
        } else {
            log.info("Periodic config reload disabled");
        }
        return this;
    }

    /**
     * Configuration used at startup. See {@link ConfigReloadLoop#currentConfig()} for the live value.
     */
    public ApiServerConfig getConfig() {
        return config;
    }

    public RuntimeState getState() {
        return state;
    }

    public ComponentCell<RateLimiterManager> getLimiter() {
        return limiter;
    }

    public ConfigReloadLoop getReloadLoop() {
        return reloadLoop;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public BucketSweeper getBucketSweeper() {
        return bucketSweeper;
    }

    /**
     * The worker draining the in-memory job queue, empty for any other queue client.
     */
    public Optional<JobWorker> getJobWorker() {
        return Optional.ofNullable(jobWorker);
    }

    @Override
    public void close() {
        log.info("Closing RuntimeFactory");
        reloadLoop.close();
        bucketSweeper.close();
        if (jobWorker != null) {
            jobWorker.close();
        }
        metricsRegistry.close();
    }
}
