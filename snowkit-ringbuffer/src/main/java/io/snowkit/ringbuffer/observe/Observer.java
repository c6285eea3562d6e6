package io.snowkit.ringbuffer.observe;

/**
 * Handle on a live observation (a subscription to a {@link Source}, or anything else
 * that keeps delivering until told to stop).
 *
 * <p>Implementations must satisfy: after a successful {@link #disconnect()},
 * {@link #isConnected()} returns false and every further {@code disconnect()} is a
 * no-op returning false.
 */
public interface Observer {

    /**
     * Stops the observation.
     *
     * @return true if this call disconnected the observer, false if it already was
     */
    boolean disconnect();

    boolean isConnected();
}
