package io.snowkit.ringbuffer;

import java.util.Optional;

/**
 * Read side of a queue with a fixed capacity.
 *
 * @param <E> element type
 * @see FixedWriteQueue
 * @see FixedReadWriteQueue
 */
public interface FixedReadQueue<E> {

    /**
     * Takes the next element from the queue.
     *
     * @return the next element, or empty if {@link #isEmpty()} is true
     */
    Optional<E> get();

    /**
     * @return true if {@link #get()} would currently return empty
     */
    boolean isEmpty();
}
