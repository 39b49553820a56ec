package io.cronkit.exception;

/**
 * Persistence failure in a {@link io.cronkit.store.JobStore}.
 */
public class JobStoreException extends CronKitException {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
