package io.snowkit.ringbuffer.lock;

import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Scoped lock helpers.
 *
 * <p>The lock is always released, including when the block throws.
 *
 * <pre>
 * Optional&lt;Frame&gt; frame = Locking.withLock(lock, buffer::get);
 * </pre>
 */
@UtilityClass
public class Locking {

    /**
     * Runs {@code block} while holding {@code lock} and returns its result.
     */
    public static <T> T withLock(Lock lock, Supplier<T> block) {
        Objects.requireNonNull(lock, "lock cannot be null");
        Objects.requireNonNull(block, "block cannot be null");
        lock.lock();
        try {
            return block.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code block} while holding {@code lock}.
     */
    public static void withLock(Lock lock, Runnable block) {
        Objects.requireNonNull(block, "block cannot be null");
        withLock(lock, () -> {
            block.run();
            return null;
        });
    }
}
