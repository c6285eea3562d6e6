package io.snowkit.ringbuffer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Bounded ring buffer with independent read and write cursors and single-step rewind.
 *
 * <p>Both cursors count items in absolute terms and only ever grow; they are reduced
 * modulo {@link #capacity()} when indexing the backing store. Reading an element
 * advances the read cursor but leaves the element in place, so {@link #rewind()} can
 * step back over it until a later {@link #put(Object)} overwrites its slot.
 *
 * <p><b>Characteristics:</b>
 * <ul>
 *   <li>Fixed capacity, backing store grows lazily up to it</li>
 *   <li>{@code put} refuses to overwrite unread elements</li>
 *   <li>O(1) {@code put}, {@code get}, {@code peek}, {@code rewind} and queries</li>
 *   <li>Iteration consumes: it is {@code get()} until empty</li>
 * </ul>
 *
 * <p><b>Thread safety:</b> none. Wrap the buffer in
 * {@link io.snowkit.ringbuffer.lock.GuardedRingBuffer} (or hold your own lock around
 * every call) when more than one thread touches it.
 *
 * <p><b>Usage:</b>
 * <pre>
 * RingBuffer&lt;String&gt; buffer = new RingBuffer&lt;&gt;(16);
 * buffer.put("a");
 * buffer.get();     // Optional[a]
 * buffer.rewind();  // true
 * buffer.peek();    // Optional[a]
 * </pre>
 *
 * @param <T> element type, null elements are not accepted
 */
public class RingBuffer<T> implements FixedReadWriteQueue<T>, Iterable<T> {

    /** Capacity used by {@link #RingBuffer()}. */
    public static final int DEFAULT_CAPACITY = 1024;

    /** Largest accepted capacity, leaving cursor headroom for rebasing. */
    public static final int MAX_CAPACITY = Integer.MAX_VALUE / 2;

    // Initial allocation for lazily grown storage
    private static final int INITIAL_STORAGE = 1024;

    private final int capacity;
    private final T fill;
    private final List<T> elements;
    private long writeCursor;
    private long readCursor;

    /**
     * Creates a buffer with {@link #DEFAULT_CAPACITY}.
     */
    public RingBuffer() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates an empty buffer. Storage is allocated as elements arrive.
     *
     * @param capacity number of unread elements the buffer can hold
     * @throws IllegalArgumentException if capacity is not in {@code 1..MAX_CAPACITY}
     */
    public RingBuffer(int capacity) {
        this.capacity = checkCapacity(capacity);
        this.fill = null;
        this.elements = new ArrayList<>(Math.min(capacity, INITIAL_STORAGE));
    }

    /**
     * Creates an empty buffer whose every slot is pre-populated with {@code fill}.
     *
     * <p>The fill value is storage only: the buffer still reports itself empty and
     * nothing can be read or rewound into until elements are put.
     *
     * @param capacity number of unread elements the buffer can hold
     * @param fill     value stored in every slot up front and after {@link #discard()}
     * @throws IllegalArgumentException if capacity is not in {@code 1..MAX_CAPACITY}
     * @throws NullPointerException     if fill is null
     */
    public RingBuffer(int capacity, T fill) {
        this.capacity = checkCapacity(capacity);
        this.fill = Objects.requireNonNull(fill, "fill cannot be null");
        this.elements = new ArrayList<>(Collections.nCopies(capacity, fill));
    }

    /**
     * Creates a pre-filled buffer with both cursors already at {@code cursor}.
     * Lets tests reach the cursor limit without billions of puts.
     */
    RingBuffer(int capacity, T fill, long cursor) {
        this(capacity, fill);
        if (cursor < 0) {
            throw new IllegalArgumentException("cursor cannot be negative");
        }
        this.writeCursor = cursor;
        this.readCursor = cursor;
    }

    private static int checkCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be > 0, was " + capacity);
        }
        if (capacity > MAX_CAPACITY) {
            throw new IllegalArgumentException(
                "Capacity must be <= " + MAX_CAPACITY + ", was " + capacity
            );
        }
        return capacity;
    }

    /**
     * Puts an element in the buffer if there is room.
     *
     * <p>Fails when the buffer holds {@link #capacity()} unread elements, since the
     * write would overwrite one of them. The buffer is unchanged in that case.
     *
     * @param item the element to store
     * @return true if stored, false if the buffer is full
     * @throws NullPointerException if item is null
     */
    @Override
    public boolean put(T item) {
        Objects.requireNonNull(item, "item cannot be null");
        if (isFull()) {
            return false;
        }
        if (writeCursor == Long.MAX_VALUE) {
            rebase();
        }

        if (elements.size() == capacity) {
            elements.set(slot(writeCursor), item);
        } else {
            elements.add(item);
        }
        writeCursor++;
        return true;
    }

    /**
     * Takes the next unread element and advances the read cursor past it.
     * The element stays in storage until overwritten, so it can be rewound to.
     *
     * @return the next element, or empty if nothing is unread
     */
    @Override
    public Optional<T> get() {
        Optional<T> next = peek();
        if (next.isPresent()) {
            readCursor++;
        }
        return next;
    }

    /**
     * Returns the next unread element without advancing the read cursor.
     *
     * @return the next element, or empty if nothing is unread
     */
    public Optional<T> peek() {
        if (isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(elements.get(slot(readCursor)));
    }

    /**
     * Steps the read cursor back by one element, un-reading it.
     *
     * @return true if rewound, false if {@link #canRewind()} did not hold
     */
    public boolean rewind() {
        if (!canRewind()) {
            return false;
        }
        readCursor--;
        return true;
    }

    /**
     * Whether {@link #rewind()} would succeed.
     *
     * <p>Once the buffer is full, the slot behind the read cursor belongs to the newest
     * element, so the previous one is gone. A read cursor at zero has nothing behind it.
     *
     * @return true if the read cursor can step back
     */
    public boolean canRewind() {
        return count() < capacity && readCursor > 0;
    }

    /**
     * Drops every element and resets both cursors. Storage is cleared immediately,
     * or re-filled with the fill value for buffers built with one.
     */
    public void discard() {
        writeCursor = 0;
        readCursor = 0;
        if (fill == null) {
            elements.clear();
        } else {
            Collections.fill(elements, fill);
        }
    }

    /**
     * @return maximum number of unread elements
     */
    public int capacity() {
        return capacity;
    }

    /**
     * @return number of unread elements
     */
    public int count() {
        return (int) (writeCursor - readCursor);
    }

    @Override
    public boolean isEmpty() {
        return writeCursor == readCursor;
    }

    @Override
    public boolean isFull() {
        return count() == capacity;
    }

    /**
     * Returns an iterator that consumes the buffer: each {@code next()} is a
     * {@link #get()}. It reflects puts and gets made while iterating.
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return !isEmpty();
            }

            @Override
            public T next() {
                return get().orElseThrow(NoSuchElementException::new);
            }
        };
    }

    /**
     * Lazily consumes the buffer as a sequential stream.
     *
     * @return a stream of the unread elements in read order
     */
    public Stream<T> drain() {
        return StreamSupport.stream(spliterator(), false);
    }

    long readCursor() {
        return readCursor;
    }

    long writeCursor() {
        return writeCursor;
    }

    private int slot(long cursor) {
        return (int) (cursor % capacity);
    }

    /**
     * Moves both cursors down to just above {@code capacity}, keeping their distance
     * and their position modulo capacity. The read cursor stays at or above capacity
     * so every rewind that was possible before remains possible.
     */
    private void rebase() {
        long unread = writeCursor - readCursor;
        readCursor = capacity + (readCursor % capacity);
        writeCursor = readCursor + unread;
    }

    @Override
    public String toString() {
        return "RingBuffer{" +
            "capacity=" + capacity +
            ", count=" + count() +
            ", readCursor=" + readCursor +
            ", writeCursor=" + writeCursor +
            '}';
    }
}
