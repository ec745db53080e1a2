package fr.lapetina.aimux.domain.model;

/**
 * Classified reason for a failed dispatch attempt.
 */
public enum FailureCause {
    /** The attempt did not complete within its own timeout. */
    TIMEOUT(true, true),
    /** The credential hit a provider-side quota. */
    RATE_LIMITED(false, false),
    /** The credential was rejected by the provider. */
    AUTH_ERROR(false, true),
    /** Connection level failure or a misbehaving bridge. */
    TRANSPORT_ERROR(true, true),
    /** The provider answered with an error. */
    PROVIDER_ERROR(true, true),
    /** The caller's deadline expired before or during the attempt. */
    DEADLINE_EXCEEDED(false, true);

    private final boolean countsAgainstHealth;
    private final boolean dropsProvider;

    FailureCause(boolean countsAgainstHealth, boolean dropsProvider) {
        this.countsAgainstHealth = countsAgainstHealth;
        this.dropsProvider = dropsProvider;
    }

    /**
     * Whether this failure advances the provider's circuit breaker.
     */
    public boolean countsAgainstHealth() {
        return countsAgainstHealth;
    }

    /**
     * Whether the provider is removed from the remaining candidates of the current request.
     */
    public boolean dropsProvider() {
        return dropsProvider;
    }
}
