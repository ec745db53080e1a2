package fr.lapetina.aimux.domain.model;

/**
 * Circuit breaker state of a provider.
 */
public enum CircuitState {
    /** Normal operation, dispatches pass through. */
    CLOSED(2),
    /** A single probe may be in flight; other requests see the provider as open. */
    HALF_OPEN(1),
    /** Too many consecutive failures; no dispatch until the cooldown elapses. */
    OPEN(0);

    private final int gaugeValue;

    CircuitState(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    /**
     * Numeric value exported by the circuit state gauge.
     */
    public int gaugeValue() {
        return gaugeValue;
    }
}
