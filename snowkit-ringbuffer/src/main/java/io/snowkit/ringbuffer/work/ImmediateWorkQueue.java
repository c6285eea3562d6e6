package io.snowkit.ringbuffer.work;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs every block immediately on the calling thread, sync or not.
 *
 * <p>Mostly useful for tests and debugging: exceptions from async blocks reach the
 * caller, and barriers hold trivially. {@link #close()} is a no-op.
 */
final class ImmediateWorkQueue implements WorkQueue {

    static final ImmediateWorkQueue INSTANCE = new ImmediateWorkQueue();

    private ImmediateWorkQueue() {
    }

    @Override
    public void async(Runnable block) {
        Objects.requireNonNull(block, "block cannot be null").run();
    }

    @Override
    public <T> T sync(Supplier<T> block) {
        return Objects.requireNonNull(block, "block cannot be null").get();
    }

    @Override
    public void asyncWithBarrier(Runnable block) {
        async(block);
    }

    @Override
    public void syncWithBarrier(Runnable block) {
        async(block);
    }

    @Override
    public void await() {
    }

    @Override
    public void close() {
    }

    @Override
    public String toString() {
        return "ImmediateWorkQueue{}";
    }
}
