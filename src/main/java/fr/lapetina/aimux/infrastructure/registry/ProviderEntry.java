package fr.lapetina.aimux.infrastructure.registry;

import fr.lapetina.aimux.domain.bridge.Bridge;
import fr.lapetina.aimux.domain.model.Provider;
import fr.lapetina.aimux.infrastructure.health.CircuitBreaker;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One provider in a registry snapshot: its immutable identity plus the mutable state objects
 * that survive reloads for the same provider id.
 */
public final class ProviderEntry {

    private final Provider provider;
    private final Bridge bridge;
    private final Map<String, Object> bridgeSettings;
    private final CredentialPool credentials;
    private final CircuitBreaker circuitBreaker;
    private final PerformanceStats performanceStats;

    ProviderEntry(
            Provider provider,
            Bridge bridge,
            Map<String, Object> bridgeSettings,
            CredentialPool credentials,
            CircuitBreaker circuitBreaker,
            PerformanceStats performanceStats
    ) {
        this.provider = Objects.requireNonNull(provider, "Provider is required");
        this.bridge = Objects.requireNonNull(bridge, "Bridge is required");
        this.bridgeSettings = bridgeSettings;
        this.credentials = Objects.requireNonNull(credentials, "Credentials are required");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "Circuit breaker is required");
        this.performanceStats = Objects.requireNonNull(performanceStats, "Performance stats are required");
    }

    public Provider getProvider() {
        return provider;
    }

    public String getId() {
        return provider.getId();
    }

    public Bridge getBridge() {
        return bridge;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public PerformanceStats getPerformanceStats() {
        return performanceStats;
    }

    /**
     * A provider without keys never enters the circuit state machine and is never eligible.
     */
    public boolean hasCredentials() {
        return !credentials.isEmpty();
    }

    /**
     * Number of keys that still have quota in their current window.
     */
    public int availableCredentials(Instant now) {
        int available = 0;
        for (CredentialSlot slot : credentials.getSlots()) {
            if (slot.hasCapacity(now)) {
                available++;
            }
        }
        return available;
    }

    Map<String, Object> getBridgeSettings() {
        return bridgeSettings;
    }

    CredentialPool getCredentials() {
        return credentials;
    }

    @Override
    public String toString() {
        return "ProviderEntry{" +
                "provider=" + provider.getId() +
                ", credentials=" + credentials.size() +
                ", circuit=" + circuitBreaker.getState() +
                '}';
    }
}
