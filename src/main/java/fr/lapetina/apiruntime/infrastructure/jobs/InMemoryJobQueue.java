package fr.lapetina.apiruntime.infrastructure.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Bounded in-process job queue.
 *
 * Accepts jobs until the capacity is reached; further submissions fail with
 * {@link JobRejectedException} until a consumer takes some out.
 */
public final class InMemoryJobQueue implements JobQueueClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobQueue.class);

    public static final int DEFAULT_CAPACITY = 1024;

    private final BlockingQueue<JobRequest> queue;
    private final int capacity;

    public InMemoryJobQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public InMemoryJobQueue() {
        this(DEFAULT_CAPACITY);
    }

    @Override
    public CompletableFuture<String> enqueue(JobRequest request) {
        if (!queue.offer(request)) {
            log.warn("Job queue full, rejecting job: jobId={}, type={}, capacity={}",
                    request.id(), request.type(), capacity);
            return CompletableFuture.failedFuture(
                    new JobRejectedException("job queue full (capacity " + capacity + ")"));
        }
        log.debug("Job enqueued: jobId={}, type={}, queued={}", request.id(), request.type(), queue.size());
        return CompletableFuture.completedFuture(request.id());
    }

    /**
     * Takes the oldest job, if any.
     */
    public Optional<JobRequest> poll() {
        return Optional.ofNullable(queue.poll());
    }

    /**
     * Takes the oldest job, waiting up to {@code timeout} for one to arrive.
     */
    public Optional<JobRequest> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Removes and returns every queued job, oldest first.
     */
    public List<JobRequest> drain() {
        List<JobRequest> jobs = new ArrayList<>();
        queue.drainTo(jobs);
        return jobs;
    }

    public int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
