package io.snowkit.ringbuffer.observe;

import lombok.experimental.UtilityClass;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Bulk helpers for {@link Observer}s.
 */
@UtilityClass
public class Observers {

    /**
     * @return true if the observer was connected and is now disconnected
     */
    public static boolean disconnect(Observer observer) {
        return Objects.requireNonNull(observer, "observer cannot be null").disconnect();
    }

    /**
     * Disconnects every observer in the list and removes it. Observers that were already
     * disconnected are removed too; only those that refused to disconnect stay.
     *
     * @param observers mutable list of observers
     * @return number of observers disconnected by this call
     */
    public static int disconnectAll(List<? extends Observer> observers) {
        Objects.requireNonNull(observers, "observers cannot be null");
        int disconnected = 0;
        Iterator<? extends Observer> it = observers.iterator();
        while (it.hasNext()) {
            Observer observer = it.next();
            if (!observer.isConnected()) {
                it.remove();
            } else if (observer.disconnect()) {
                disconnected++;
                it.remove();
            }
        }
        return disconnected;
    }
}
