package fr.lapetina.apiruntime.infrastructure.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit entries to the {@code audit} logger. Used when no audit
 * directory is configured.
 */
public final class Slf4jAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void append(AuditEntry entry) {
        audit.info("category={}, message={}, timestamp={}, metadata={}",
                entry.category(), entry.message(), entry.timestamp(), entry.metadata());
    }

    @Override
    public String describe() {
        return "logger:" + LOGGER_NAME;
    }
}
