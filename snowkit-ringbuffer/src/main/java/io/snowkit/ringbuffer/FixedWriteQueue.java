package io.snowkit.ringbuffer;

/**
 * Write side of a queue with a fixed capacity.
 *
 * <p>A {@link #put(Object)} only succeeds while {@link #isFull()} is false;
 * a full queue never makes room by discarding elements.
 *
 * @param <E> element type
 * @see FixedReadQueue
 * @see FixedReadWriteQueue
 */
public interface FixedWriteQueue<E> {

    /**
     * Offers an element to the queue.
     *
     * @param element the element to store
     * @return true if the element was stored, false if the queue is full
     */
    boolean put(E element);

    /**
     * @return true if {@link #put(Object)} would currently fail
     */
    boolean isFull();
}
