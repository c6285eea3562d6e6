package io.snowkit.ringbuffer.work;

import lombok.experimental.UtilityClass;

import java.util.concurrent.ExecutorService;

/**
 * Entry points for the {@link WorkQueue} implementations.
 */
@UtilityClass
public class WorkQueues {

    /**
     * @return the shared queue that runs blocks on the calling thread
     */
    public static WorkQueue immediate() {
        return ImmediateWorkQueue.INSTANCE;
    }

    /**
     * @param name queue name, used for configuration lookup and the worker thread name
     * @return a new single-threaded FIFO queue
     */
    public static SerialWorkQueue serial(String name) {
        return new SerialWorkQueue(name);
    }

    /**
     * @param executor executor to run blocks on; closing the queue shuts it down
     * @return a queue without barrier support
     */
    public static ExecutorWorkQueue fromExecutor(ExecutorService executor) {
        return new ExecutorWorkQueue(executor);
    }
}
