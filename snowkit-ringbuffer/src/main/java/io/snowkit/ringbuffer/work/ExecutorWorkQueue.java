package io.snowkit.ringbuffer.work;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link WorkQueue} over an {@link ExecutorService}.
 *
 * <p>An executor may run blocks concurrently and offers no way to fence one off, so the
 * barrier methods throw {@link BarrierUnsupportedException}. The queue owns the executor:
 * {@link #close()} shuts it down, and the queue counts as closed once the executor is
 * shut down, whoever did it. A rejection from an executor that is still running (a
 * saturated bounded pool, say) is rethrown as is.
 */
public class ExecutorWorkQueue implements WorkQueue {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorWorkQueue.class);

    private final ExecutorService executor;
    private final long shutdownTimeoutMs;
    private final PendingWork pending = new PendingWork();

    public ExecutorWorkQueue(ExecutorService executor) {
        this(executor, 1000L);
    }

    public ExecutorWorkQueue(ExecutorService executor, long shutdownTimeoutMs) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    @Override
    public void async(Runnable block) {
        Objects.requireNonNull(block, "block cannot be null");
        pending.scheduled();
        try {
            executor.execute(() -> {
                try {
                    block.run();
                } catch (Throwable t) {
                    logger.error("Error executing block on {}", executor, t);
                } finally {
                    pending.finished();
                }
            });
        } catch (RejectedExecutionException e) {
            pending.finished();
            if (!executor.isShutdown()) {
                throw e;
            }
            logger.warn("Work queue over {} is closed, dropping block", executor);
        }
    }

    @Override
    public <T> T sync(Supplier<T> block) {
        Objects.requireNonNull(block, "block cannot be null");
        pending.scheduled();
        Future<T> future;
        try {
            future = executor.submit(() -> {
                try {
                    return block.get();
                } finally {
                    pending.finished();
                }
            });
        } catch (RejectedExecutionException e) {
            pending.finished();
            if (!executor.isShutdown()) {
                throw e;
            }
            throw new IllegalStateException("Work queue over " + executor + " is closed", e);
        }

        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkQueueException("Interrupted waiting on " + executor, e);
        } catch (CancellationException e) {
            throw new IllegalStateException("Work queue over " + executor + " closed before block ran", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new WorkQueueException("Block failed on " + executor, cause);
        }
    }

    @Override
    public void asyncWithBarrier(Runnable block) {
        throw new BarrierUnsupportedException("Async barrier blocks are unsupported for executor work queues");
    }

    @Override
    public void syncWithBarrier(Runnable block) {
        throw new BarrierUnsupportedException("Sync barrier blocks are unsupported for executor work queues");
    }

    @Override
    public void await() {
        pending.awaitIdle(() -> !executor.isTerminated(), "Executor work queue");
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warn("Executor did not terminate within {} ms, forcing shutdown", shutdownTimeoutMs);
                abandon(executor.shutdownNow());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(executor.shutdownNow());
        }
        pending.wakeAll();
    }

    private void abandon(List<Runnable> dropped) {
        for (Runnable block : dropped) {
            if (block instanceof Future) {
                ((Future<?>) block).cancel(false);
            }
        }
        pending.abandoned(dropped.size());
        if (!dropped.isEmpty()) {
            logger.warn("Executor stopped with {} blocks still queued", dropped.size());
        }
    }

    @Override
    public String toString() {
        return "ExecutorWorkQueue{executor=" + executor + "}";
    }
}
