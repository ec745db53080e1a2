package fr.lapetina.aimux.infrastructure.health;

import fr.lapetina.aimux.domain.event.RoutingEvent;
import fr.lapetina.aimux.domain.event.RoutingEventSink;
import fr.lapetina.aimux.domain.model.Outcome;

import java.time.Clock;
import java.util.Objects;

/**
 * Feeds attempt outcomes into circuit breakers and publishes their transitions.
 *
 * Timeouts, transport errors and provider errors count against the circuit.
 * Rate limits, auth errors and expired caller deadlines only release a held probe slot.
 */
public final class HealthMonitor {

    private final RoutingEventSink events;
    private final Clock clock;
    private volatile HealthPolicy policy;

    public HealthMonitor(HealthPolicy policy, RoutingEventSink events, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "Health policy is required");
        this.events = events != null ? events : RoutingEventSink.noop();
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    /**
     * Creates a breaker wired to publish its transitions.
     */
    public CircuitBreaker newCircuitBreaker(String providerId) {
        return new CircuitBreaker(providerId, policy, clock, this::onTransition);
    }

    /**
     * Records the outcome of a dispatch made without a permit, as through a closed circuit.
     */
    public void record(CircuitBreaker breaker, Outcome outcome) {
        record(breaker, null, outcome);
    }

    /**
     * Records an outcome against the permit it was dispatched under. While the circuit is
     * HALF_OPEN only the probe permit's outcome moves it.
     */
    public void record(CircuitBreaker breaker, DispatchPermit permit, Outcome outcome) {
        if (outcome.success()) {
            breaker.recordSuccess(permit);
        } else if (outcome.cause().countsAgainstHealth()) {
            breaker.recordFailure(permit);
        } else {
            breaker.releaseProbe(permit);
        }
    }

    public HealthPolicy getPolicy() {
        return policy;
    }

    public void setPolicy(HealthPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Health policy is required");
    }

    private void onTransition(String providerId, HealthState from, HealthState to) {
        events.emit(RoutingEvent.circuitTransition(
                providerId, from.state(), to.state(), to.failureStreak(), to.lastTransition()));
    }
}
