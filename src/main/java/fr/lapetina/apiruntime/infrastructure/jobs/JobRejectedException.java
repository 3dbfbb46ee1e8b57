package fr.lapetina.apiruntime.infrastructure.jobs;

/**
 * The queue did not accept a job.
 */
public class JobRejectedException extends RuntimeException {

    public JobRejectedException(String message) {
        super(message);
    }
}
