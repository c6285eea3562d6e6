package io.snowkit.ringbuffer.work;

/**
 * Raised when waiting on a {@link WorkQueue} is interrupted, or when a scheduled block
 * fails with a checked exception.
 */
public class WorkQueueException extends RuntimeException {

    public WorkQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
