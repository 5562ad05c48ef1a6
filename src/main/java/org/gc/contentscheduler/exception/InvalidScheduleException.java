package org.gc.contentscheduler.exception;

/**
 * The schedule's configuration is unusable: its timing fields cannot produce a
 * fire time, or the site or template it points at is gone.
 */
public class InvalidScheduleException extends RuntimeException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
