package fr.lapetina.apiruntime.infrastructure.audit;

/**
 * Destination for audit records.
 *
 * Implementations hold no open resources between appends, so a replaced sink
 * needs no shutdown and stays usable by requests that still reference it.
 * They must be safe to call from many request threads at once.
 */
public interface AuditSink {

    /**
     * Appends one entry.
     *
     * @throws AuditException if the entry could not be written
     */
    void append(AuditEntry entry);

    /**
     * Short description of the destination, for logs.
     */
    String describe();
}
