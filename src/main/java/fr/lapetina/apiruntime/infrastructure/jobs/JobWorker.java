package fr.lapetina.apiruntime.infrastructure.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Single consumer thread draining an {@link InMemoryJobQueue}.
 *
 * Jobs are handed to the handler oldest first. A handler failure is logged and
 * counted; the worker moves on to the next job.
 */
public final class JobWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    static final Duration POLL_TIMEOUT = Duration.ofMillis(200);

    private final InMemoryJobQueue queue;
    private final Consumer<JobRequest> handler;
    private final ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public JobWorker(InMemoryJobQueue queue, Consumer<JobRequest> handler) {
        this.queue = Objects.requireNonNull(queue, "Job queue is required");
        this.handler = Objects.requireNonNull(handler, "Job handler is required");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "job-worker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * A worker that only logs each job it takes.
     */
    public static JobWorker logging(InMemoryJobQueue queue) {
        return new JobWorker(queue, job ->
                log.info("Job processed: jobId={}, type={}, createdAt={}", job.id(), job.type(), job.createdAt()));
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            executor.execute(this::run);
            log.info("Job worker started");
        }
    }

    private void run() {
        while (running.get()) {
            Optional<JobRequest> next;
            try {
                next = queue.poll(POLL_TIMEOUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            next.ifPresent(this::process);
        }
        log.debug("Job worker loop exited: processed={}, failed={}", processed.get(), failed.get());
    }

    private void process(JobRequest job) {
        try {
            handler.accept(job);
            processed.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.error("Job handler failed: jobId={}, type={}, error={}", job.id(), job.type(), e.getMessage(), e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getProcessedCount() {
        return processed.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Job worker stopping: queued={}", queue.size());
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
