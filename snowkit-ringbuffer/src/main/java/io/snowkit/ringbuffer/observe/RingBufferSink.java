package io.snowkit.ringbuffer.observe;

import io.snowkit.ringbuffer.lock.GuardedRingBuffer;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Subscriber that parks emissions in a bounded {@link GuardedRingBuffer} for a consumer
 * to drain at its own pace.
 *
 * <p>When the buffer is full the emission is dropped and counted; nothing unread is
 * overwritten. Drops are logged at warn level for the first one and every
 * {@value #DROP_LOG_INTERVAL}th after that.
 *
 * <pre>
 * RingBufferSink&lt;Reading&gt; sink = new RingBufferSink&lt;&gt;("readings", 256);
 * Observer observer = source.subscribe(sink);
 * ...
 * sink.drainTo(this::process);
 * </pre>
 *
 * @param <E> emission type
 */
public class RingBufferSink<E> implements Consumer<E> {

    private static final Logger logger = LoggerFactory.getLogger(RingBufferSink.class);

    static final long DROP_LOG_INTERVAL = 1000;

    @Getter
    private final String name;
    @Getter
    private final GuardedRingBuffer<E> buffer;
    private final AtomicLong dropped = new AtomicLong();

    public RingBufferSink(String name, int capacity) {
        this(name, new GuardedRingBuffer<>(capacity));
    }

    public RingBufferSink(String name, GuardedRingBuffer<E> buffer) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.buffer = Objects.requireNonNull(buffer, "buffer cannot be null");
    }

    @Override
    public void accept(E emission) {
        if (buffer.put(emission)) {
            return;
        }
        long drops = dropped.incrementAndGet();
        if (drops == 1 || drops % DROP_LOG_INTERVAL == 0) {
            logger.warn("Sink '{}' is full (capacity {}), {} emissions dropped so far",
                name, buffer.capacity(), drops);
        }
    }

    /**
     * Consumes everything buffered so far.
     *
     * @return number of emissions handed to {@code consumer}
     */
    public int drainTo(Consumer<? super E> consumer) {
        return buffer.drainTo(consumer);
    }

    /**
     * @return emissions dropped because the buffer was full
     */
    public long dropped() {
        return dropped.get();
    }

    @Override
    public String toString() {
        return "RingBufferSink{name=" + name + ", buffer=" + buffer + ", dropped=" + dropped.get() + "}";
    }
}
