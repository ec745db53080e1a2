package fr.lapetina.aimux.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.aimux.disruptor.handlers.EventLoggingHandler;
import fr.lapetina.aimux.disruptor.handlers.EventMetricsHandler;
import fr.lapetina.aimux.disruptor.handlers.ListenerDispatchHandler;
import fr.lapetina.aimux.domain.event.RoutingEvent;
import fr.lapetina.aimux.domain.event.RoutingEventHolder;
import fr.lapetina.aimux.domain.event.RoutingEventHolderFactory;
import fr.lapetina.aimux.domain.event.RoutingEventListener;
import fr.lapetina.aimux.domain.event.RoutingEventSink;
import fr.lapetina.aimux.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asynchronous routing event bus backed by an LMAX Disruptor ring buffer.
 *
 * <p>Routing threads publish with {@link RingBuffer#tryNext()} and never wait:
 * when the ring buffer is full the event is dropped and counted. Consumers run
 * in two stages:
 * <pre>
 * (Logging, Metrics) → Listener dispatch
 * </pre>
 * Logging and metrics handle each event in parallel; listeners see it afterwards,
 * and the listener stage clears the slot for reuse.
 *
 * <p>Events emitted before {@link #start()} wait in the ring buffer; events emitted
 * after {@link #close()} are dropped.
 */
public final class EventBus implements RoutingEventSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Disruptor<RoutingEventHolder> disruptor;
    private final RingBuffer<RoutingEventHolder> ringBuffer;
    private final ListenerDispatchHandler listenerHandler;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong droppedEvents = new AtomicLong(0);
    private final AtomicBoolean dropWarned = new AtomicBoolean(false);

    private EventBus(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;

        this.disruptor = new Disruptor<>(
                new RoutingEventHolderFactory(),
                builder.ringBufferSize,
                new EventBusThreadFactory("routing-events"),
                ProducerType.MULTI, // Router, prober and admin threads all publish
                createWaitStrategy(builder.waitStrategy)
        );

        this.listenerHandler = new ListenerDispatchHandler();
        EventLoggingHandler loggingHandler = new EventLoggingHandler();
        if (metricsRegistry != null) {
            disruptor.handleEventsWith(loggingHandler, new EventMetricsHandler(metricsRegistry))
                    .then(listenerHandler);
        } else {
            disruptor.handleEventsWith(loggingHandler)
                    .then(listenerHandler);
        }
        disruptor.setDefaultExceptionHandler(new EventBusExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("EventBus created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the consumer threads.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("EventBus is closed");
        }
        if (started.compareAndSet(false, true)) {
            disruptor.start();
            log.info("EventBus started");
        }
    }

    /**
     * Publishes an event without blocking. Drops it when the ring buffer is full.
     */
    @Override
    public void emit(RoutingEvent event) {
        if (event == null) {
            return;
        }
        if (closed.get()) {
            log.debug("EventBus closed, dropping event: type={}", event.type());
            return;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            onDropped(event);
            return;
        }

        try {
            ringBuffer.get(sequence).set(event, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }

        if (metricsRegistry != null) {
            metricsRegistry.setRingBufferRemaining(ringBuffer.remainingCapacity());
        }
    }

    private void onDropped(RoutingEvent event) {
        long dropped = droppedEvents.incrementAndGet();
        if (metricsRegistry != null) {
            metricsRegistry.incrementDroppedEvents();
        }
        if (dropWarned.compareAndSet(false, true)) {
            log.warn("Event ring buffer full, dropping events: firstDropped={}, bufferSize={}",
                    event.type(), ringBuffer.getBufferSize());
        } else {
            log.debug("Event dropped: type={}, totalDropped={}", event.type(), dropped);
        }
    }

    public void addListener(RoutingEventListener listener) {
        listenerHandler.addListener(listener);
    }

    public void removeListener(RoutingEventListener listener) {
        listenerHandler.removeListener(listener);
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public int getBufferSize() {
        return ringBuffer.getBufferSize();
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    /**
     * Drains published events, then stops the consumer threads.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!started.get()) {
            log.info("EventBus closed before start");
            return;
        }
        log.info("Shutting down EventBus...");
        try {
            disruptor.shutdown(10, TimeUnit.SECONDS);
            log.info("EventBus shut down: droppedEvents={}", droppedEvents.get());
        } catch (TimeoutException e) {
            log.warn("EventBus shutdown timed out, halting...");
            disruptor.halt();
        }
    }

    static WaitStrategy createWaitStrategy(String name) {
        String key = name == null ? "blocking" : name.toLowerCase();
        return switch (key) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    /**
     * Daemon threads so that a forgotten bus never keeps the JVM alive.
     */
    private static class EventBusThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        EventBusThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class EventBusExceptionHandler implements ExceptionHandler<RoutingEventHolder> {

        private static final Logger log = LoggerFactory.getLogger(EventBusExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, RoutingEventHolder holder) {
            log.error("Exception in event handler: sequence={}, holder={}", sequence, holder, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during EventBus start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during EventBus shutdown", ex);
        }
    }

    /**
     * Builder for EventBus.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (size < 1 || Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public EventBus build() {
            return new EventBus(this);
        }
    }
}
