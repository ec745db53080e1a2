package fr.lapetina.aimux.disruptor;

import fr.lapetina.aimux.domain.event.RoutingEvent;
import fr.lapetina.aimux.domain.event.RoutingEventListener;
import fr.lapetina.aimux.domain.event.RoutingEventType;
import fr.lapetina.aimux.domain.model.FailureCause;
import fr.lapetina.aimux.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventBusTest {

    private EventBus bus;
    private MetricsRegistry metrics;

    @AfterEach
    void tearDown() {
        if (bus != null) {
            bus.close();
        }
        if (metrics != null) {
            metrics.close();
        }
    }

    private static RoutingEventListener counting(List<RoutingEvent> seen, CountDownLatch latch) {
        return event -> {
            seen.add(event);
            latch.countDown();
        };
    }

    @Nested
    @DisplayName("Delivery")
    class DeliveryTests {

        @Test
        @DisplayName("should deliver events to every listener in publication order")
        void shouldDeliverToListeners() throws Exception {
            bus = EventBus.builder().ringBufferSize(64).build();
            List<RoutingEvent> first = new CopyOnWriteArrayList<>();
            List<RoutingEvent> second = new CopyOnWriteArrayList<>();
            CountDownLatch latch = new CountDownLatch(6);
            bus.addListener(counting(first, latch));
            bus.addListener(counting(second, latch));
            bus.start();

            bus.emit(RoutingEvent.providerReset("alpha"));
            bus.emit(RoutingEvent.configRejected("bad bridge"));
            bus.emit(RoutingEvent.configReloaded(2, 3));

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(first).extracting(RoutingEvent::type).containsExactly(
                    RoutingEventType.PROVIDER_RESET,
                    RoutingEventType.CONFIG_REJECTED,
                    RoutingEventType.CONFIG_RELOADED);
            assertThat(second).containsExactlyElementsOf(first);
            assertThat(bus.isRunning()).isTrue();
        }

        @Test
        @DisplayName("should keep events emitted before start and deliver them once started")
        void shouldBufferBeforeStart() throws Exception {
            bus = EventBus.builder().ringBufferSize(8).build();
            List<RoutingEvent> seen = new CopyOnWriteArrayList<>();
            CountDownLatch latch = new CountDownLatch(2);
            bus.addListener(counting(seen, latch));

            bus.emit(RoutingEvent.providerReset("alpha"));
            bus.emit(RoutingEvent.providerReset("beta"));
            assertThat(bus.isRunning()).isFalse();
            assertThat(bus.getRemainingCapacity()).isEqualTo(6);

            bus.start();

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen).extracting(RoutingEvent::providerId).containsExactly("alpha", "beta");
        }

        @Test
        @DisplayName("should isolate a failing listener from the others")
        void shouldIsolateFailingListener() throws Exception {
            bus = EventBus.builder().ringBufferSize(16).build();
            List<RoutingEvent> seen = new CopyOnWriteArrayList<>();
            CountDownLatch latch = new CountDownLatch(2);
            bus.addListener(event -> {
                throw new IllegalStateException("listener bug");
            });
            bus.addListener(counting(seen, latch));
            bus.start();

            bus.emit(RoutingEvent.providerReset("alpha"));
            bus.emit(RoutingEvent.providerReset("beta"));

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen).hasSize(2);
        }

        @Test
        @DisplayName("should stop delivering to a removed listener")
        void shouldRemoveListener() throws Exception {
            bus = EventBus.builder().ringBufferSize(16).build();
            List<RoutingEvent> removed = new CopyOnWriteArrayList<>();
            RoutingEventListener listener = removed::add;
            CountDownLatch latch = new CountDownLatch(1);
            bus.addListener(listener);
            bus.addListener(event -> latch.countDown());
            bus.removeListener(listener);
            bus.start();

            bus.emit(RoutingEvent.providerReset("alpha"));

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(removed).isEmpty();
        }

        @Test
        @DisplayName("should deliver every event published by concurrent producers")
        void shouldAcceptConcurrentProducers() throws Exception {
            bus = EventBus.builder().ringBufferSize(1024).build();
            int producers = 8;
            int perProducer = 100;
            CountDownLatch latch = new CountDownLatch(producers * perProducer);
            bus.addListener(event -> latch.countDown());
            bus.start();

            ExecutorService executor = Executors.newFixedThreadPool(producers);
            for (int p = 0; p < producers; p++) {
                String providerId = "p" + p;
                executor.submit(() -> {
                    for (int i = 0; i < perProducer; i++) {
                        bus.emit(RoutingEvent.providerReset(providerId));
                    }
                });
            }
            executor.shutdown();

            assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(bus.getDroppedEvents()).isZero();
        }
    }

    @Nested
    @DisplayName("Backpressure")
    class BackpressureTests {

        @Test
        @DisplayName("should drop and count events once the ring buffer is full")
        void shouldDropWhenFull() {
            bus = EventBus.builder().ringBufferSize(4).build();

            for (int i = 0; i < 6; i++) {
                bus.emit(RoutingEvent.providerReset("p" + i));
            }

            assertThat(bus.getDroppedEvents()).isEqualTo(2);
            assertThat(bus.getRemainingCapacity()).isZero();
            assertThat(bus.getBufferSize()).isEqualTo(4);
        }

        @Test
        @DisplayName("should count dropped events in metrics")
        void shouldCountDroppedEventsInMetrics() {
            metrics = new MetricsRegistry("aimux_bus_test");
            bus = EventBus.builder().ringBufferSize(2).metricsRegistry(metrics).build();

            for (int i = 0; i < 5; i++) {
                bus.emit(RoutingEvent.providerReset("p" + i));
            }

            assertThat(metrics.getDroppedEvents()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("should ignore events after close")
        void shouldIgnoreAfterClose() {
            bus = EventBus.builder().ringBufferSize(4).build();
            bus.start();
            bus.close();

            bus.emit(RoutingEvent.providerReset("alpha"));

            assertThat(bus.getDroppedEvents()).isZero();
            assertThat(bus.isRunning()).isFalse();
            assertThatThrownBy(() -> bus.start()).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should reject a ring buffer size that is not a power of 2")
        void shouldRejectInvalidSize() {
            assertThatThrownBy(() -> EventBus.builder().ringBufferSize(1000))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> EventBus.builder().ringBufferSize(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("should record attempts in metrics before listeners see them")
    void shouldRecordMetricsBeforeListeners() throws Exception {
        metrics = new MetricsRegistry("aimux_bus_test");
        bus = EventBus.builder().ringBufferSize(16).metricsRegistry(metrics).build();
        CountDownLatch latch = new CountDownLatch(2);
        bus.addListener(event -> latch.countDown());
        bus.start();

        bus.emit(RoutingEvent.attemptSucceeded("r1", "r1", "alpha", "a1", Duration.ofMillis(40), 1));
        bus.emit(RoutingEvent.attemptFailed("r2", "r2", "alpha", "a1",
                FailureCause.TIMEOUT, Duration.ofMillis(500), 1, "slow"));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(metrics.getRegistry().get("aimux_bus_test_attempts_total")
                .tag("provider", "alpha").tag("outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("aimux_bus_test_attempts_total")
                .tag("provider", "alpha").tag("outcome", "timeout").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("aimux_bus_test_attempt_latency")
                .tag("provider", "alpha").timer().count()).isEqualTo(2);
    }
}
