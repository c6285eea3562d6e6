package io.snowkit.ringbuffer.work;

import io.snowkit.ringbuffer.config.HierarchicalConfig;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Supplier;

/**
 * {@link WorkQueue} that runs blocks one at a time, in FIFO order, on a dedicated
 * worker thread.
 *
 * <p><b>Characteristics:</b>
 * <ul>
 *   <li>Unbounded {@link LinkedBlockingQueue} feeding one daemon platform thread</li>
 *   <li>Strict FIFO execution, so every block is already a barrier block</li>
 *   <li>A failing async block is logged and the worker moves on, whatever it throws</li>
 *   <li>{@code sync} called from the worker thread runs the block inline</li>
 *   <li>Blocks still queued at {@link #close()} are dropped; waiting sync callers
 *       get an {@link IllegalStateException}</li>
 * </ul>
 *
 * <p>Configuration ({@link HierarchicalConfig#forWorkQueue(String)}):
 * {@code workqueue.thread-name-prefix} and {@code workqueue.shutdown-timeout-ms}.
 */
public class SerialWorkQueue implements WorkQueue {

    private static final Logger logger = LoggerFactory.getLogger(SerialWorkQueue.class);

    static final String THREAD_PREFIX_KEY = "workqueue.thread-name-prefix";
    static final String SHUTDOWN_TIMEOUT_KEY = "workqueue.shutdown-timeout-ms";

    @Getter
    private final String name;
    private final long shutdownTimeoutMs;
    private final BlockingQueue<Runnable> blocks = new LinkedBlockingQueue<>();
    private final PendingWork pending = new PendingWork();
    private final Object stateLock = new Object();
    private final Thread processor;
    @Getter
    private volatile boolean running = true;

    /**
     * Creates a serial queue configured from {@code snowkit_{name}.properties}.
     *
     * @param name queue name, also used in the worker thread name
     */
    public SerialWorkQueue(String name) {
        this(name, HierarchicalConfig.forWorkQueue(name));
    }

    public SerialWorkQueue(String name, HierarchicalConfig config) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        this.shutdownTimeoutMs = config.getLong(SHUTDOWN_TIMEOUT_KEY, 1000L);

        this.processor = new Thread(this::processQueue,
            config.getString(THREAD_PREFIX_KEY, "snowkit-work") + "-" + name);
        this.processor.setDaemon(true);
        this.processor.start();
    }

    @Override
    public void async(Runnable block) {
        Objects.requireNonNull(block, "block cannot be null");
        if (!enqueue(block)) {
            logger.warn("Work queue '{}' is closed, dropping block", name);
        }
    }

    @Override
    public <T> T sync(Supplier<T> block) {
        Objects.requireNonNull(block, "block cannot be null");
        if (isWorkerThread()) {
            return block.get();
        }

        FutureTask<T> task = new FutureTask<>(block::get);
        if (!enqueue(task)) {
            throw new IllegalStateException("Work queue '" + name + "' is closed");
        }
        return awaitResult(task);
    }

    @Override
    public void asyncWithBarrier(Runnable block) {
        async(block);
    }

    @Override
    public void syncWithBarrier(Runnable block) {
        sync(block);
    }

    /**
     * @throws IllegalStateException if called from the worker thread
     */
    @Override
    public void await() {
        if (isWorkerThread()) {
            throw new IllegalStateException(
                "Cannot await work queue '" + name + "' from its own worker thread"
            );
        }
        pending.awaitIdle(() -> running, "Work queue '" + name + "'");
    }

    /**
     * Stops the worker, waiting up to the configured shutdown timeout for the block in
     * progress. Blocks that never started are dropped.
     */
    @Override
    public void close() {
        synchronized (stateLock) {
            if (!running) {
                return;
            }
            running = false;
        }
        processor.interrupt();
        pending.wakeAll();

        if (!isWorkerThread()) {
            try {
                processor.join(shutdownTimeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        List<Runnable> dropped = new ArrayList<>();
        blocks.drainTo(dropped);
        for (Runnable block : dropped) {
            if (block instanceof Future) {
                ((Future<?>) block).cancel(false);
            }
        }
        pending.abandoned(dropped.size());
        if (!dropped.isEmpty()) {
            logger.warn("Work queue '{}' closed with {} blocks still queued", name, dropped.size());
        }
        logger.debug("Work queue '{}' closed", name);
    }

    /**
     * @return true if nothing is queued or running
     */
    public boolean isIdle() {
        return pending.count() == 0;
    }

    private boolean isWorkerThread() {
        return Thread.currentThread() == processor;
    }

    private boolean enqueue(Runnable block) {
        synchronized (stateLock) {
            if (!running) {
                return false;
            }
            pending.scheduled();
            blocks.offer(block);
            return true;
        }
    }

    private <T> T awaitResult(FutureTask<T> task) {
        try {
            return task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkQueueException("Interrupted waiting on work queue '" + name + "'", e);
        } catch (CancellationException e) {
            throw new IllegalStateException("Work queue '" + name + "' closed before block ran", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new WorkQueueException("Block failed on work queue '" + name + "'", cause);
        }
    }

    /**
     * Worker loop: takes blocks in FIFO order until closed.
     */
    private void processQueue() {
        while (running && !Thread.currentThread().isInterrupted()) {
            Runnable block;
            try {
                block = blocks.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                block.run();
            } catch (Throwable t) {
                logger.error("Error executing block on work queue '{}'", name, t);
            } finally {
                pending.finished();
            }
        }
    }

    @Override
    public String toString() {
        return "SerialWorkQueue{name=" + name + ", running=" + running + "}";
    }
}
