package io.snowkit.ringbuffer.work;

/**
 * Thrown when a barrier block is scheduled on a {@link WorkQueue} that cannot keep
 * other blocks from running alongside it.
 */
public class BarrierUnsupportedException extends UnsupportedOperationException {

    public BarrierUnsupportedException(String message) {
        super(message);
    }
}
