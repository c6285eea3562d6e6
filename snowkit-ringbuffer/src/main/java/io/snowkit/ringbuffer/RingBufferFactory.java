package io.snowkit.ringbuffer;

import io.snowkit.ringbuffer.config.ConfigurationException;
import io.snowkit.ringbuffer.config.HierarchicalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Creates {@link RingBuffer} instances sized from configuration.
 *
 * <p>The default capacity comes from {@code ringbuffer.default-capacity}, resolved through
 * {@link HierarchicalConfig}: system property, then {@code snowkit_{name}.properties}
 * for named factories, then {@code snowkit.properties}, then
 * {@link RingBuffer#DEFAULT_CAPACITY}.
 *
 * <p><b>Usage:</b>
 * <pre>
 * RingBufferFactory factory = RingBufferFactory.forBuffer("audit");
 * RingBuffer&lt;Event&gt; events = factory.create();
 * </pre>
 *
 * <p><b>Thread safety:</b> factories are immutable; the buffers they create are not
 * thread-safe.
 */
public final class RingBufferFactory {

    private static final Logger logger = LoggerFactory.getLogger(RingBufferFactory.class);

    static final String DEFAULT_CAPACITY_KEY = "ringbuffer.default-capacity";

    private final String name;
    private final int defaultCapacity;

    private RingBufferFactory(String name, int defaultCapacity) {
        this.name = name;
        this.defaultCapacity = defaultCapacity;
    }

    /**
     * Factory using global configuration.
     *
     * @return a factory for unnamed buffers
     */
    public static RingBufferFactory getInstance() {
        return fromConfig("global", HierarchicalConfig.global());
    }

    /**
     * Factory using the configuration of the named buffer.
     *
     * @param bufferName buffer name used to resolve {@code snowkit_{bufferName}.properties}
     * @return a factory for that buffer
     */
    public static RingBufferFactory forBuffer(String bufferName) {
        return fromConfig(bufferName, HierarchicalConfig.forBuffer(bufferName));
    }

    /**
     * Factory using an explicit configuration.
     *
     * @param name   label used in logs
     * @param config configuration to read the default capacity from
     * @return the factory
     * @throws ConfigurationException if the configured capacity is not a valid capacity
     */
    public static RingBufferFactory fromConfig(String name, HierarchicalConfig config) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(config, "config cannot be null");

        int capacity = config.contains(DEFAULT_CAPACITY_KEY)
            ? config.getInt(DEFAULT_CAPACITY_KEY)
            : RingBuffer.DEFAULT_CAPACITY;
        if (capacity <= 0 || capacity > RingBuffer.MAX_CAPACITY) {
            throw new ConfigurationException(
                "Invalid " + DEFAULT_CAPACITY_KEY + " in context " + config.context() + ": " + capacity
            );
        }
        return new RingBufferFactory(name, capacity);
    }

    /**
     * @return a buffer with the configured default capacity
     */
    public <T> RingBuffer<T> create() {
        return create(defaultCapacity);
    }

    /**
     * @param capacity buffer capacity
     * @return a new empty buffer
     */
    public <T> RingBuffer<T> create(int capacity) {
        RingBuffer<T> buffer = new RingBuffer<>(capacity);
        logger.debug("Created ring buffer '{}' with capacity {}", name, capacity);
        return buffer;
    }

    /**
     * @param capacity buffer capacity
     * @param fill     value pre-populating every slot
     * @return a new empty, pre-filled buffer
     */
    public <T> RingBuffer<T> create(int capacity, T fill) {
        RingBuffer<T> buffer = new RingBuffer<>(capacity, fill);
        logger.debug("Created pre-filled ring buffer '{}' with capacity {}", name, capacity);
        return buffer;
    }

    public int defaultCapacity() {
        return defaultCapacity;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "RingBufferFactory{name=" + name + ", defaultCapacity=" + defaultCapacity + "}";
    }
}
