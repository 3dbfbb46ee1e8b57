package fr.lapetina.apiruntime.infrastructure.audit;

import fr.lapetina.apiruntime.infrastructure.config.ApiServerConfig;

import java.nio.file.Path;

/**
 * Factory for the audit sink selected by the logging configuration.
 */
public final class AuditSinks {

    private AuditSinks() {
    }

    /**
     * A file sink in {@code logging.logDir} when set, otherwise the SLF4J sink.
     */
    public static AuditSink fromConfig(ApiServerConfig.LoggingConfig logging) {
        if (logging.logDir() == null || logging.logDir().isBlank()) {
            return new Slf4jAuditSink();
        }
        return new FileAuditSink(Path.of(logging.logDir()));
    }
}
