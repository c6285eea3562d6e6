package io.snowkit.ringbuffer.lock;

import io.snowkit.ringbuffer.FixedReadWriteQueue;
import io.snowkit.ringbuffer.RingBuffer;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A {@link RingBuffer} whose every operation runs under one lock.
 *
 * <p>Single calls are atomic. A check followed by an action ({@code canRewind()} then
 * {@code rewind()}, {@code isFull()} then {@code put()}) is not: run such sequences
 * through {@link #withBuffer(Function)}.
 *
 * <p>Iteration is not offered because a consuming iterator cannot hold the lock
 * between calls; use {@link #drainTo(Consumer)}.
 *
 * @param <T> element type
 */
public class GuardedRingBuffer<T> implements FixedReadWriteQueue<T> {

    private final RingBuffer<T> buffer;
    private final Lock lock;

    public GuardedRingBuffer(int capacity) {
        this(new RingBuffer<>(capacity));
    }

    /**
     * Guards an existing buffer with a fresh {@link ReentrantLock}. The caller must not
     * keep using {@code buffer} directly.
     */
    public GuardedRingBuffer(RingBuffer<T> buffer) {
        this(buffer, new ReentrantLock());
    }

    public GuardedRingBuffer(RingBuffer<T> buffer, Lock lock) {
        this.buffer = Objects.requireNonNull(buffer, "buffer cannot be null");
        this.lock = Objects.requireNonNull(lock, "lock cannot be null");
    }

    @Override
    public boolean put(T element) {
        return Locking.withLock(lock, () -> buffer.put(element));
    }

    @Override
    public Optional<T> get() {
        return Locking.withLock(lock, buffer::get);
    }

    public Optional<T> peek() {
        return Locking.withLock(lock, buffer::peek);
    }

    public boolean rewind() {
        return Locking.withLock(lock, buffer::rewind);
    }

    public boolean canRewind() {
        return Locking.withLock(lock, buffer::canRewind);
    }

    public void discard() {
        Locking.withLock(lock, buffer::discard);
    }

    public int capacity() {
        return buffer.capacity();
    }

    public int count() {
        return Locking.withLock(lock, buffer::count);
    }

    @Override
    public boolean isEmpty() {
        return Locking.withLock(lock, buffer::isEmpty);
    }

    @Override
    public boolean isFull() {
        return Locking.withLock(lock, buffer::isFull);
    }

    /**
     * Consumes every unread element under a single lock acquisition.
     *
     * @param consumer receives the elements in read order, while the lock is held
     * @return number of elements drained
     */
    public int drainTo(Consumer<? super T> consumer) {
        Objects.requireNonNull(consumer, "consumer cannot be null");
        return Locking.withLock(lock, () -> {
            int drained = 0;
            for (T element : buffer) {
                consumer.accept(element);
                drained++;
            }
            return drained;
        });
    }

    /**
     * Runs a compound action against the underlying buffer while holding the lock.
     * The buffer reference must not escape {@code action}.
     */
    public <R> R withBuffer(Function<RingBuffer<T>, R> action) {
        Objects.requireNonNull(action, "action cannot be null");
        return Locking.withLock(lock, () -> action.apply(buffer));
    }

    @Override
    public String toString() {
        return Locking.withLock(lock, () -> "Guarded" + buffer);
    }
}
