package fr.lapetina.aimux.infrastructure.registry;

import fr.lapetina.aimux.domain.model.CircuitState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the registry for status endpoints and diagnostics. Secrets are masked.
 */
public record RegistryStatus(long generation, Instant generatedAt, List<ProviderStatus> providers) {

    public RegistryStatus {
        providers = providers != null ? List.copyOf(providers) : List.of();
    }

    public Optional<ProviderStatus> provider(String providerId) {
        return providers.stream()
                .filter(p -> p.id().equals(providerId))
                .findFirst();
    }

    /**
     * @param available enabled, dispatchable circuit and at least one key with quota left
     */
    public record ProviderStatus(
            String id,
            String displayName,
            String bridgeType,
            List<String> capabilities,
            String costClass,
            String speedClass,
            int priority,
            boolean enabled,
            boolean available,
            HealthView health,
            List<CredentialStatus> credentials,
            PerformanceView performance
    ) {
    }

    public record HealthView(
            CircuitState state,
            int failureStreak,
            int probeSuccesses,
            boolean probeInFlight,
            long cooldownMs,
            Instant lastTransition,
            Instant nextRetryAt
    ) {
    }

    public record CredentialStatus(
            String id,
            String maskedSecret,
            boolean current,
            int usedInWindow,
            int quota,
            Instant windowStart,
            int consecutiveFailures,
            Instant lastUsed
    ) {
    }

    /**
     * @param meanLatencyMs null when there are no successful samples in the window
     */
    public record PerformanceView(
            int windowSamples,
            int latencySamples,
            Double meanLatencyMs,
            double successRate,
            long totalSuccesses,
            long totalFailures,
            long totalTimeouts
    ) {
    }
}
