package fr.lapetina.aimux.infrastructure.health;

import fr.lapetina.aimux.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Circuit breaker protecting one provider.
 *
 * States:
 * - CLOSED: Normal operation, dispatches pass through
 * - OPEN: Failures reached the threshold, dispatches rejected until the cooldown elapses
 * - HALF_OPEN: A single probe dispatch at a time decides whether to close or reopen;
 *   only the outcome reported with its {@link DispatchPermit} counts
 *
 * The whole state is one immutable {@link HealthState} swapped by compare-and-set,
 * so readers never see a half-applied transition.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    /**
     * Notified after every change of {@link CircuitState}.
     */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(String providerId, HealthState from, HealthState to);
    }

    private final String providerId;
    private final Clock clock;
    private final TransitionListener listener;
    private final AtomicReference<HealthState> state;
    private final AtomicLong probeTickets = new AtomicLong(DispatchPermit.NO_PROBE);
    private volatile HealthPolicy policy;

    public CircuitBreaker(String providerId, HealthPolicy policy, Clock clock, TransitionListener listener) {
        this.providerId = Objects.requireNonNull(providerId, "Provider ID is required");
        this.policy = Objects.requireNonNull(policy, "Health policy is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.listener = listener != null ? listener : (id, from, to) -> { };
        this.state = new AtomicReference<>(HealthState.initial(clock.instant(), policy));
    }

    public CircuitBreaker(String providerId, HealthPolicy policy, Clock clock) {
        this(providerId, policy, clock, null);
    }

    /**
     * Health gate applied right before a dispatch.
     * Always grants in CLOSED. Otherwise claims the single probe slot, moving an
     * open circuit whose cooldown elapsed to HALF_OPEN.
     *
     * @return the permit to report the outcome with, or empty if the caller may not dispatch.
     *         A probe permit holds the slot until its outcome is recorded or it is released.
     */
    public Optional<DispatchPermit> tryAcquireDispatch() {
        while (true) {
            HealthState current = state.get();
            Instant now = clock.instant();
            if (!current.isDispatchable(now)) {
                return Optional.empty();
            }
            if (current.state() == CircuitState.CLOSED) {
                return Optional.of(DispatchPermit.unprobed(providerId));
            }
            Optional<DispatchPermit> probe = claimProbe(current, now);
            if (probe.isPresent()) {
                return probe;
            }
        }
    }

    /**
     * Claims the probe slot only when the circuit is not closed. Used by active probing.
     */
    public Optional<DispatchPermit> tryAcquireProbe() {
        while (true) {
            HealthState current = state.get();
            Instant now = clock.instant();
            if (!current.isProbeGrantable(now)) {
                return Optional.empty();
            }
            Optional<DispatchPermit> probe = claimProbe(current, now);
            if (probe.isPresent()) {
                return probe;
            }
        }
    }

    private Optional<DispatchPermit> claimProbe(HealthState current, Instant now) {
        long ticket = probeTickets.incrementAndGet();
        HealthState next = current.claimProbe(now, ticket);
        if (!state.compareAndSet(current, next)) {
            return Optional.empty();
        }
        afterUpdate(current, next);
        log.debug("Probe slot claimed: providerId={}, ticket={}", providerId, ticket);
        return Optional.of(new DispatchPermit(providerId, ticket));
    }

    /**
     * Pure read: would {@link #tryAcquireDispatch()} grant right now.
     */
    public boolean isDispatchable() {
        return state.get().isDispatchable(clock.instant());
    }

    /**
     * Success of a dispatch that went through without a probe permit.
     */
    public void recordSuccess() {
        recordSuccess(null);
    }

    public void recordSuccess(DispatchPermit permit) {
        long ticket = ticketOf(permit);
        update(s -> s.onSuccess(clock.instant(), policy, ticket));
    }

    /**
     * Failure of a dispatch that went through without a probe permit.
     */
    public void recordFailure() {
        recordFailure(null);
    }

    public void recordFailure(DispatchPermit permit) {
        long ticket = ticketOf(permit);
        update(s -> s.onFailure(clock.instant(), policy, ticket));
    }

    /**
     * Returns the probe slot held by {@code permit} without affecting the circuit.
     * Does nothing for a permit that holds no slot, or whose slot is gone.
     */
    public void releaseProbe(DispatchPermit permit) {
        long ticket = ticketOf(permit);
        update(s -> s.releaseProbe(ticket));
    }

    private static long ticketOf(DispatchPermit permit) {
        return permit != null ? permit.probeTicket() : DispatchPermit.NO_PROBE;
    }

    /**
     * Forces the circuit back to CLOSED with a cleared streak and the base cooldown. Admin use.
     */
    public void reset() {
        HealthState fresh = HealthState.initial(clock.instant(), policy);
        HealthState old = state.getAndSet(fresh);
        log.info("Circuit breaker reset: providerId={}, previousState={}", providerId, old.state());
        afterUpdate(old, fresh);
    }

    /**
     * Applies new thresholds from a configuration reload. The current state is kept.
     */
    public void updatePolicy(HealthPolicy newPolicy) {
        this.policy = Objects.requireNonNull(newPolicy, "Health policy is required");
    }

    public HealthPolicy getPolicy() {
        return policy;
    }

    public CircuitState getState() {
        return state.get().state();
    }

    public HealthState getHealthState() {
        return state.get();
    }

    public int getFailureStreak() {
        return state.get().failureStreak();
    }

    public String getProviderId() {
        return providerId;
    }

    private void update(UnaryOperator<HealthState> transition) {
        while (true) {
            HealthState current = state.get();
            HealthState next = transition.apply(current);
            if (next == current) {
                return;
            }
            if (state.compareAndSet(current, next)) {
                afterUpdate(current, next);
                return;
            }
        }
    }

    private void afterUpdate(HealthState from, HealthState to) {
        if (from.state() == to.state()) {
            return;
        }
        if (to.state() == CircuitState.OPEN) {
            log.warn("Circuit breaker OPENED: providerId={}, from={}, failureStreak={}, cooldownMs={}",
                    providerId, from.state(), to.failureStreak(), to.cooldown().toMillis());
        } else {
            log.info("Circuit breaker {}: providerId={}, from={}", to.state(), providerId, from.state());
        }
        try {
            listener.onTransition(providerId, from, to);
        } catch (Exception e) {
            log.error("Error notifying circuit transition listener: providerId={}", providerId, e);
        }
    }

    @Override
    public String toString() {
        HealthState current = state.get();
        return "CircuitBreaker{" +
                "providerId='" + providerId + '\'' +
                ", state=" + current.state() +
                ", failureStreak=" + current.failureStreak() +
                ", probeInFlight=" + current.probeInFlight() +
                '}';
    }
}
