package io.snowkit.ringbuffer.work;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Counts scheduled blocks that have not finished yet and lets threads wait for zero.
 * A block counts from the moment it is queued, so a waiter never mistakes
 * "taken but not started" for idle.
 */
final class PendingWork {

    private final AtomicInteger pending = new AtomicInteger();
    private final Object idleLock = new Object();

    void scheduled() {
        pending.incrementAndGet();
    }

    void finished() {
        if (pending.decrementAndGet() == 0) {
            synchronized (idleLock) {
                idleLock.notifyAll();
            }
        }
    }

    /** Forgets blocks that will never run, e.g. ones left queued at close. */
    void abandoned(int count) {
        if (count > 0 && pending.addAndGet(-count) <= 0) {
            synchronized (idleLock) {
                idleLock.notifyAll();
            }
        }
    }

    int count() {
        return pending.get();
    }

    /**
     * Waits until nothing is pending or {@code active} turns false.
     *
     * @throws WorkQueueException if interrupted, with the interrupt flag restored
     */
    void awaitIdle(BooleanSupplier active, String context) {
        synchronized (idleLock) {
            while (active.getAsBoolean() && pending.get() > 0) {
                try {
                    idleLock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new WorkQueueException(context + " await interrupted", e);
                }
            }
        }
    }

    /** Wakes waiters so they can re-check {@code active}. */
    void wakeAll() {
        synchronized (idleLock) {
            idleLock.notifyAll();
        }
    }
}
