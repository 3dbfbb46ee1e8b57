package fr.lapetina.apiruntime.infrastructure.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * One audit record.
 *
 * @param timestamp when the audited event happened
 * @param category  coarse grouping, e.g. {@code request} or {@code config}
 * @param message   short human-readable summary
 * @param metadata  structured details, never null
 */
public record AuditEntry(Instant timestamp, String category, String message, JsonNode metadata) {

    public AuditEntry {
        Objects.requireNonNull(timestamp, "Timestamp is required");
        Objects.requireNonNull(category, "Category is required");
        Objects.requireNonNull(message, "Message is required");
        metadata = metadata != null ? metadata : JsonNodeFactory.instance.objectNode();
    }

    public static AuditEntry now(String category, String message, JsonNode metadata) {
        return new AuditEntry(Instant.now(), category, message, metadata);
    }
}
