package fr.lapetina.apiruntime.integration;

import fr.lapetina.apiruntime.RuntimeFactory;
import fr.lapetina.apiruntime.infrastructure.config.ApiServerConfig;
import fr.lapetina.apiruntime.infrastructure.config.ConfigLoader;
import fr.lapetina.apiruntime.infrastructure.config.ConfigSource;
import fr.lapetina.apiruntime.infrastructure.config.StandardConfigValidator;
import fr.lapetina.apiruntime.infrastructure.jobs.InMemoryJobQueue;
import fr.lapetina.apiruntime.infrastructure.logging.LogLevelReloader;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Test extension of RuntimeFactory whose configuration can be edited in place
 * and whose log level changes are recorded instead of applied.
 */
public final class TestRuntimeFactory extends RuntimeFactory {

    private final EditableSource source;
    private final RecordingLevelReloader levels;
    private final InMemoryJobQueue jobQueue;

    private TestRuntimeFactory(EditableSource source, RecordingLevelReloader levels, InMemoryJobQueue jobQueue) {
        super(source, new StandardConfigValidator(), levels, jobQueue);
        this.source = source;
        this.levels = levels;
        this.jobQueue = jobQueue;
    }

    /**
     * Creates a test runtime from the default test configuration.
     */
    public static TestRuntimeFactory create() {
        return create("test-config.yaml");
    }

    /**
     * Creates a test runtime from a custom configuration path, ignoring the environment.
     */
    public static TestRuntimeFactory create(String configPath) {
        EditableSource source = new EditableSource(new ConfigLoader(configPath, Map.of()));
        return new TestRuntimeFactory(source, new RecordingLevelReloader(), new InMemoryJobQueue());
    }

    /**
     * Replaces what the next reload cycle will load.
     */
    public void setConfig(ApiServerConfig config) {
        source.override.set(config);
    }

    /**
     * Makes the next reload cycles fail to load.
     */
    public void breakSource() {
        source.broken = true;
    }

    public List<String> getAppliedLevels() {
        return levels.applied;
    }

    public InMemoryJobQueue getJobQueue() {
        return jobQueue;
    }

    static final class EditableSource implements ConfigSource {
        private final ConfigSource delegate;
        private final AtomicReference<ApiServerConfig> override = new AtomicReference<>();
        private volatile boolean broken;

        EditableSource(ConfigSource delegate) {
            this.delegate = delegate;
        }

        @Override
        public ApiServerConfig load() {
            if (broken) {
                return new ConfigLoader("missing-config.yaml", Map.of()).load();
            }
            ApiServerConfig config = override.get();
            return config != null ? config : delegate.load();
        }
    }

    static final class RecordingLevelReloader implements LogLevelReloader {
        private final List<String> applied = new CopyOnWriteArrayList<>();

        @Override
        public void reload(String level) {
            applied.add(level);
        }
    }
}
