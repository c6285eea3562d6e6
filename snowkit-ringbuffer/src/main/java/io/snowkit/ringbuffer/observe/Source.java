package io.snowkit.ringbuffer.observe;

import java.util.function.Consumer;

/**
 * Something that can be observed.
 *
 * @param <E> emission type
 */
public interface Source<E> {

    /**
     * Registers a subscriber. It receives every emission until the returned observer is
     * disconnected.
     *
     * @param subscriber receives emissions
     * @return handle used to unsubscribe
     */
    Observer subscribe(Consumer<? super E> subscriber);
}
