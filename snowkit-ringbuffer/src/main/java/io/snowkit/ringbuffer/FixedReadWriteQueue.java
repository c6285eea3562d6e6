package io.snowkit.ringbuffer;

/**
 * A fixed-capacity queue that can be both written and read.
 *
 * @param <E> element type
 */
public interface FixedReadWriteQueue<E> extends FixedWriteQueue<E>, FixedReadQueue<E> {
}
