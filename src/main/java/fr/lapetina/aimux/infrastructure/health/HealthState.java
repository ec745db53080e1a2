package fr.lapetina.aimux.infrastructure.health;

import fr.lapetina.aimux.domain.model.CircuitState;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable circuit breaker state of one provider.
 *
 * <p>Every transition is a pure function returning a new value (or this one when nothing changes),
 * so {@link CircuitBreaker} can apply it with a single compare-and-set.
 *
 * <ul>
 *   <li>CLOSED: failures increment the streak; reaching the failure threshold opens the circuit.</li>
 *   <li>OPEN: nothing is dispatched until {@code nextRetryAt}; then one probe slot can be claimed,
 *       which moves the circuit to HALF_OPEN.</li>
 *   <li>HALF_OPEN: at most one probe in flight, identified by {@code probeTicket}. Only the outcome
 *       carrying that ticket counts: a failed probe reopens with a doubled cooldown, enough
 *       consecutive successes close the circuit and restore the base cooldown. Outcomes of
 *       dispatches made before the circuit opened are ignored, as in OPEN.</li>
 * </ul>
 */
public record HealthState(
        CircuitState state,
        int failureStreak,
        int probeSuccesses,
        long probeTicket,
        Duration cooldown,
        Instant lastTransition,
        Instant openedAt,
        Instant nextRetryAt
) {
    public HealthState {
        Objects.requireNonNull(state, "State is required");
        Objects.requireNonNull(cooldown, "Cooldown is required");
        Objects.requireNonNull(lastTransition, "Last transition is required");
    }

    public static HealthState initial(Instant now, HealthPolicy policy) {
        return new HealthState(CircuitState.CLOSED, 0, 0, DispatchPermit.NO_PROBE, policy.cooldown(), now, null, null);
    }

    public boolean probeInFlight() {
        return probeTicket != DispatchPermit.NO_PROBE;
    }

    /**
     * Whether a dispatch could be granted right now. Pure read, no transition.
     */
    public boolean isDispatchable(Instant now) {
        return switch (state) {
            case CLOSED -> true;
            case OPEN -> nextRetryAt != null && !now.isBefore(nextRetryAt);
            case HALF_OPEN -> !probeInFlight();
        };
    }

    /**
     * Whether a probe slot can be claimed right now: open past its cooldown, or half-open and idle.
     */
    public boolean isProbeGrantable(Instant now) {
        return state != CircuitState.CLOSED && isDispatchable(now);
    }

    HealthState claimProbe(Instant now, long ticket) {
        if (ticket == DispatchPermit.NO_PROBE) {
            throw new IllegalArgumentException("Probe ticket must not be " + DispatchPermit.NO_PROBE);
        }
        if (!isProbeGrantable(now)) {
            throw new IllegalStateException("Probe slot not grantable in state " + state);
        }
        if (state == CircuitState.OPEN) {
            return new HealthState(CircuitState.HALF_OPEN, failureStreak, 0, ticket,
                    cooldown, now, openedAt, nextRetryAt);
        }
        return new HealthState(state, failureStreak, probeSuccesses, ticket,
                cooldown, lastTransition, openedAt, nextRetryAt);
    }

    HealthState onSuccess(Instant now, HealthPolicy policy, long ticket) {
        switch (state) {
            case CLOSED:
                if (failureStreak == 0) {
                    return this;
                }
                return new HealthState(CircuitState.CLOSED, 0, 0, DispatchPermit.NO_PROBE,
                        cooldown, lastTransition, null, null);
            case HALF_OPEN:
                if (!holdsProbe(ticket)) {
                    return this;
                }
                int successes = probeSuccesses + 1;
                if (successes >= policy.successThreshold()) {
                    return new HealthState(CircuitState.CLOSED, 0, 0, DispatchPermit.NO_PROBE,
                            policy.cooldown(), now, null, null);
                }
                return new HealthState(CircuitState.HALF_OPEN, failureStreak, successes, DispatchPermit.NO_PROBE,
                        cooldown, lastTransition, openedAt, nextRetryAt);
            default:
                // Late outcome of a dispatch made before the circuit opened
                return this;
        }
    }

    HealthState onFailure(Instant now, HealthPolicy policy, long ticket) {
        switch (state) {
            case CLOSED:
                int streak = failureStreak + 1;
                if (streak >= policy.failureThreshold()) {
                    return open(now, streak, policy.cooldown());
                }
                return new HealthState(CircuitState.CLOSED, streak, 0, DispatchPermit.NO_PROBE,
                        cooldown, lastTransition, null, null);
            case HALF_OPEN:
                if (!holdsProbe(ticket)) {
                    return this;
                }
                return open(now, failureStreak + 1, policy.nextCooldown(cooldown));
            default:
                return this;
        }
    }

    /**
     * Frees the probe slot held by {@code ticket} without counting a success or a failure.
     */
    HealthState releaseProbe(long ticket) {
        if (state == CircuitState.HALF_OPEN && holdsProbe(ticket)) {
            return new HealthState(state, failureStreak, probeSuccesses, DispatchPermit.NO_PROBE,
                    cooldown, lastTransition, openedAt, nextRetryAt);
        }
        return this;
    }

    private boolean holdsProbe(long ticket) {
        return ticket != DispatchPermit.NO_PROBE && ticket == probeTicket;
    }

    private static HealthState open(Instant now, int streak, Duration cooldown) {
        return new HealthState(CircuitState.OPEN, streak, 0, DispatchPermit.NO_PROBE,
                cooldown, now, now, now.plus(cooldown));
    }
}
