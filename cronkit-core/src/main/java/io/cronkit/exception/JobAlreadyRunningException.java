package io.cronkit.exception;

/**
 * Raised by a manual run when an execution of the same job is still in flight.
 */
public class JobAlreadyRunningException extends CronKitException {

    private final String jobId;

    public JobAlreadyRunningException(String jobId) {
        super("Job already running: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
