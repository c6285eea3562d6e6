package io.snowkit.ringbuffer.observe;

import io.snowkit.ringbuffer.work.SerialWorkQueue;
import io.snowkit.ringbuffer.work.WorkQueue;
import io.snowkit.ringbuffer.work.WorkQueues;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EmitterSourceTest {

    @Mock
    private Consumer<String> first;

    @Mock
    private Consumer<String> second;

    @Test
    void shouldDeliverToEverySubscriberInOrder() {
        EmitterSource<String> source = new EmitterSource<>("events");
        source.subscribe(first);
        source.subscribe(second);

        source.emit("a");
        source.emit("b");

        InOrder order = inOrder(first);
        order.verify(first).accept("a");
        order.verify(first).accept("b");
        verify(second).accept("a");
        verify(second).accept("b");
        assertThat(source.subscriberCount()).isEqualTo(2);
    }

    @Test
    void shouldStopDeliveringAfterDisconnect() {
        EmitterSource<String> source = new EmitterSource<>("events");
        Observer observer = source.subscribe(first);

        assertThat(observer.isConnected()).isTrue();
        assertThat(observer.disconnect()).isTrue();
        assertThat(observer.disconnect()).isFalse();
        assertThat(observer.isConnected()).isFalse();

        source.emit("late");

        verify(first, never()).accept(any());
        assertThat(source.hasSubscribers()).isFalse();
    }

    @Test
    void shouldIsolateFailingSubscribers() {
        EmitterSource<String> source = new EmitterSource<>("events");
        doThrow(new IllegalStateException("subscriber bug")).when(first).accept("x");
        source.subscribe(first);
        source.subscribe(second);

        source.emit("x");

        verify(second).accept("x");
    }

    @Test
    void shouldDeliverThroughWorkQueue() {
        List<String> threads = new CopyOnWriteArrayList<>();
        List<String> received = new CopyOnWriteArrayList<>();
        try (SerialWorkQueue queue = new SerialWorkQueue("delivery")) {
            EmitterSource<String> source = new EmitterSource<>("events", queue);
            source.subscribe(value -> {
                received.add(value);
                threads.add(Thread.currentThread().getName());
            });

            source.emit("1");
            source.emit("2");
            queue.await();
        }

        assertThat(received).containsExactly("1", "2");
        assertThat(threads).containsOnly("snowkit-work-delivery");
    }

    @Test
    void shouldEmitQuietlyAfterDeliveryQueueCloses() {
        WorkQueue queue = WorkQueues.fromExecutor(Executors.newSingleThreadExecutor());
        EmitterSource<String> source = new EmitterSource<>("events", queue);
        source.subscribe(first);
        source.subscribe(second);
        queue.close();

        assertThatCode(() -> source.emit("late")).doesNotThrowAnyException();

        verify(first, never()).accept(any());
        verify(second, never()).accept(any());
    }

    @Test
    void shouldBulkDisconnectSubscriptions() {
        EmitterSource<String> source = new EmitterSource<>("events");
        List<Observer> observers = new ArrayList<>(List.of(
            source.subscribe(first),
            source.subscribe(second)
        ));

        assertThat(Observers.disconnectAll(observers)).isEqualTo(2);
        assertThat(observers).isEmpty();
        assertThat(source.subscriberCount()).isZero();
    }

    @Test
    void shouldRejectNulls() {
        EmitterSource<String> source = new EmitterSource<>("events");

        assertThatThrownBy(() -> source.subscribe(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("subscriber cannot be null");
        assertThatThrownBy(() -> source.emit(null))
            .isInstanceOf(NullPointerException.class);
    }
}
