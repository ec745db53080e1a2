package fr.lapetina.aimux.infrastructure.metrics;

import fr.lapetina.aimux.domain.model.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Attempt counters and latency timers per provider
 * - Route results, circuit transitions and auth failures
 * - Circuit state and available credential gauges per provider
 * - Event bus capacity and dropped events
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> routeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> authFailureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> reloadCounters = new ConcurrentHashMap<>();
    private final Set<String> providerGauges = ConcurrentHashMap.newKeySet();

    private final Counter droppedEvents;
    private final AtomicLong ringBufferRemaining = new AtomicLong(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.droppedEvents = Counter.builder(prefix + "_events_dropped_total")
                .description("Routing events dropped because the ring buffer was full")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicLong::get)
                .description("Remaining capacity in the event ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("aimux");
    }

    /**
     * Counts one dispatch attempt and records its latency.
     *
     * @param outcome "success" or the lowercase failure cause
     */
    public void recordAttempt(String providerId, String outcome, Duration latency) {
        String key = providerId + ":" + outcome;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Dispatch attempts by provider and outcome")
                        .tag("provider", providerId)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        if (latency != null) {
            latencyTimers.computeIfAbsent(providerId, k ->
                    Timer.builder(prefix + "_attempt_latency")
                            .description("Dispatch attempt latency")
                            .tag("provider", providerId)
                            .publishPercentileHistogram()
                            .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                            .register(registry)
            ).record(latency);
        }
    }

    /**
     * Counts a finished routing decision.
     *
     * @param result "success", "exhausted", "no_eligible_provider" or "no_credential"
     */
    public void incrementRouteCount(String result) {
        routeCounters.computeIfAbsent(result, k ->
                Counter.builder(prefix + "_routes_total")
                        .description("Routing decisions by result")
                        .tag("result", result)
                        .register(registry)
        ).increment();
    }

    public void incrementCircuitTransition(String providerId, CircuitState to) {
        String key = providerId + ":" + to.name();
        transitionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_circuit_transitions_total")
                        .description("Circuit breaker transitions by provider and target state")
                        .tag("provider", providerId)
                        .tag("state", to.name())
                        .register(registry)
        ).increment();
    }

    public void incrementAuthFailure(String providerId, String credentialId) {
        String key = providerId + ":" + credentialId;
        authFailureCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_credential_auth_failures_total")
                        .description("Credentials rejected by their provider")
                        .tag("provider", providerId)
                        .tag("credential", credentialId)
                        .register(registry)
        ).increment();
    }

    public void incrementConfigReload(boolean accepted) {
        String result = accepted ? "accepted" : "rejected";
        reloadCounters.computeIfAbsent(result, k ->
                Counter.builder(prefix + "_config_reloads_total")
                        .description("Configuration reloads by result")
                        .tag("result", result)
                        .register(registry)
        ).increment();
    }

    public void incrementDroppedEvents() {
        droppedEvents.increment();
    }

    public double getDroppedEvents() {
        return droppedEvents.count();
    }

    public void setRingBufferRemaining(long value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Registers the per-provider gauges once per provider id.
     * The suppliers are looked up on every scrape, so they must resolve the provider by id
     * rather than capture a snapshot entry.
     */
    public void registerProviderGauges(
            String providerId,
            Supplier<Number> circuitState,
            Supplier<Number> credentialsAvailable
    ) {
        if (!providerGauges.add(providerId)) {
            return;
        }
        Gauge.builder(prefix + "_provider_circuit_state", circuitState, s -> s.get().doubleValue())
                .description("Circuit state per provider (0=OPEN, 1=HALF_OPEN, 2=CLOSED, -1=removed)")
                .tag("provider", providerId)
                .register(registry);
        Gauge.builder(prefix + "_provider_credentials_available", credentialsAvailable, s -> s.get().doubleValue())
                .description("Credentials with quota left in the current window")
                .tag("provider", providerId)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
