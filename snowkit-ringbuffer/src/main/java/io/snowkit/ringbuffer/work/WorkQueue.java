package io.snowkit.ringbuffer.work;

import java.util.function.Supplier;

/**
 * Somewhere to schedule blocks of work.
 *
 * <p>{@code async} returns as soon as the block is queued; {@code sync} returns once it
 * has run. Barrier variants additionally guarantee that no other block of the same
 * queue runs concurrently with the barrier block. Queues that cannot make that promise
 * throw {@link BarrierUnsupportedException} rather than run the block without it.
 *
 * <p>Once a queue is closed, {@code async} logs the block and drops it, and {@code sync}
 * throws {@link IllegalStateException}. A sync caller whose block was still queued at
 * close gets the same exception. Queues with nothing to close, such as
 * {@link WorkQueues#immediate()}, keep accepting work.
 *
 * <p>Calling {@code sync} for a queue from a block already running on a different,
 * single-threaded queue that feeds back into it can deadlock. Avoid nested sync calls
 * across queues.
 *
 * @see WorkQueues
 */
public interface WorkQueue extends AutoCloseable {

    /**
     * Schedules a block and returns without waiting for it. Dropped with a warning if
     * the queue is closed.
     */
    void async(Runnable block);

    /**
     * Schedules a block and waits until it has finished.
     * A runtime exception thrown by the block is rethrown to the caller.
     */
    default void sync(Runnable block) {
        sync(() -> {
            block.run();
            return null;
        });
    }

    /**
     * Schedules a block, waits until it has finished and returns its result.
     * A runtime exception thrown by the block is rethrown to the caller.
     *
     * @throws IllegalStateException if the queue is closed before the block runs
     */
    <T> T sync(Supplier<T> block);

    /**
     * Schedules a block that runs with no other block of this queue running.
     *
     * @throws BarrierUnsupportedException if this queue cannot isolate the block
     */
    void asyncWithBarrier(Runnable block);

    /**
     * Like {@link #asyncWithBarrier(Runnable)} but waits for the block to finish.
     *
     * @throws BarrierUnsupportedException if this queue cannot isolate the block
     */
    void syncWithBarrier(Runnable block);

    /**
     * Blocks until every block scheduled so far has finished.
     */
    void await();

    /**
     * Stops accepting work and releases the queue's threads. Closing twice is harmless.
     */
    @Override
    void close();
}
