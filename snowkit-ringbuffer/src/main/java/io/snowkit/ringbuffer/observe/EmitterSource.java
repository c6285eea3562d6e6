package io.snowkit.ringbuffer.observe;

import io.snowkit.ringbuffer.work.WorkQueue;
import io.snowkit.ringbuffer.work.WorkQueues;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link Source} that pushes emissions to its subscribers, optionally through a
 * {@link WorkQueue}.
 *
 * <p>Subscribers are kept in a {@link CopyOnWriteArrayList}: emissions are frequent,
 * subscribe and disconnect are rare. A subscriber that throws is logged and does not
 * affect the others. A subscriber disconnected while a delivery to it is still queued
 * on the work queue does not receive it.
 *
 * @param <E> emission type
 */
public class EmitterSource<E> implements Source<E> {

    private static final Logger logger = LoggerFactory.getLogger(EmitterSource.class);

    @Getter
    private final String name;
    private final WorkQueue workQueue;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    /**
     * Source delivering on the emitting thread.
     */
    public EmitterSource(String name) {
        this(name, WorkQueues.immediate());
    }

    /**
     * @param name      label used in logs
     * @param workQueue queue every delivery is scheduled on
     */
    public EmitterSource(String name, WorkQueue workQueue) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.workQueue = Objects.requireNonNull(workQueue, "workQueue cannot be null");
    }

    @Override
    public Observer subscribe(Consumer<? super E> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber cannot be null");
        Subscription subscription = new Subscription(subscriber);
        subscriptions.add(subscription);
        logger.debug("Subscriber added to source '{}' ({} total)", name, subscriptions.size());
        return subscription;
    }

    /**
     * Hands the emission to every connected subscriber.
     *
     * @param emission the value to deliver
     */
    public void emit(E emission) {
        Objects.requireNonNull(emission, "emission cannot be null");
        for (Subscription subscription : subscriptions) {
            workQueue.async(() -> subscription.deliver(emission));
        }
    }

    /**
     * @return number of connected subscribers
     */
    public int subscriberCount() {
        return subscriptions.size();
    }

    public boolean hasSubscribers() {
        return !subscriptions.isEmpty();
    }

    @Override
    public String toString() {
        return "EmitterSource{name=" + name + ", subscribers=" + subscriptions.size() + "}";
    }

    private final class Subscription implements Observer {

        private final Consumer<? super E> subscriber;
        private final AtomicBoolean connected = new AtomicBoolean(true);

        private Subscription(Consumer<? super E> subscriber) {
            this.subscriber = subscriber;
        }

        void deliver(E emission) {
            if (!connected.get()) {
                return;
            }
            try {
                subscriber.accept(emission);
            } catch (RuntimeException e) {
                logger.warn("Subscriber of source '{}' failed on emission", name, e);
            }
        }

        @Override
        public boolean disconnect() {
            if (connected.compareAndSet(true, false)) {
                subscriptions.remove(this);
                return true;
            }
            return false;
        }

        @Override
        public boolean isConnected() {
            return connected.get();
        }
    }
}
