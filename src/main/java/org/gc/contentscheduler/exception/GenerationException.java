package org.gc.contentscheduler.exception;

/**
 * Raised by a content generator when a title or body could not be produced.
 * The message is classified as-is, so it should carry the provider's wording.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
