package io.cronkit.exception;

/**
 * Base type for every error raised by the scheduler API.
 */
public class CronKitException extends RuntimeException {

    public CronKitException(String message) {
        super(message);
    }

    public CronKitException(String message, Throwable cause) {
        super(message, cause);
    }
}
