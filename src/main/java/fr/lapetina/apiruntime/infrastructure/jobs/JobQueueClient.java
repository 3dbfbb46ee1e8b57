package fr.lapetina.apiruntime.infrastructure.jobs;

import java.util.concurrent.CompletableFuture;

/**
 * Client side of a background job queue.
 *
 * Delivery guarantees are up to the implementation. Callers that treat a job
 * as best effort must handle both a synchronous exception and a failed future.
 */
public interface JobQueueClient {

    /**
     * Submits a job.
     *
     * @return future completed with the job id once the queue accepted it,
     *         or completed exceptionally with {@link JobRejectedException}
     */
    CompletableFuture<String> enqueue(JobRequest request);
}
