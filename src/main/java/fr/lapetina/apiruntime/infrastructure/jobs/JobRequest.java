package fr.lapetina.apiruntime.infrastructure.jobs;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Background job submitted to a {@link JobQueueClient}.
 *
 * @param id        unique job id
 * @param type      job type, e.g. {@code config.reload}
 * @param payload   job-specific JSON payload
 * @param createdAt submission time
 */
public record JobRequest(String id, String type, JsonNode payload, Instant createdAt) {

    public JobRequest {
        Objects.requireNonNull(id, "Job id is required");
        Objects.requireNonNull(type, "Job type is required");
        Objects.requireNonNull(payload, "Job payload is required");
        Objects.requireNonNull(createdAt, "Creation time is required");
    }

    public static JobRequest of(String type, JsonNode payload) {
        return new JobRequest(UUID.randomUUID().toString(), type, payload, Instant.now());
    }
}
