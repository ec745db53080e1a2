package fr.lapetina.aimux.infrastructure.health;

import java.util.Objects;

/**
 * Grant handed out by the health gate of a {@link CircuitBreaker}.
 *
 * <p>A permit granted while the circuit was CLOSED carries no probe ticket. A permit that
 * claimed the half-open probe slot carries the ticket of that slot, and only an outcome
 * reported with that ticket can close or reopen the circuit.
 */
public record DispatchPermit(String providerId, long probeTicket) {

    static final long NO_PROBE = 0L;

    public DispatchPermit {
        Objects.requireNonNull(providerId, "Provider ID is required");
    }

    /**
     * Permit of a dispatch made through a closed circuit.
     */
    public static DispatchPermit unprobed(String providerId) {
        return new DispatchPermit(providerId, NO_PROBE);
    }

    /**
     * Whether this permit holds the probe slot.
     */
    public boolean isProbe() {
        return probeTicket != NO_PROBE;
    }
}
