package fr.lapetina.aimux.domain.event;

import fr.lapetina.aimux.domain.model.CircuitState;
import fr.lapetina.aimux.domain.model.FailureCause;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable observation emitted by the routing core.
 * Fields that do not apply to the event type are null.
 */
public record RoutingEvent(
        RoutingEventType type,
        Instant timestamp,
        String requestId,
        String correlationId,
        String providerId,
        String credentialId,
        FailureCause cause,
        CircuitState fromState,
        CircuitState toState,
        Duration latency,
        int attempts,
        String message
) {
    public RoutingEvent {
        Objects.requireNonNull(type, "Event type is required");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static RoutingEvent attemptSucceeded(
            String requestId, String correlationId, String providerId, String credentialId,
            Duration latency, int attempt
    ) {
        return new RoutingEvent(RoutingEventType.ATTEMPT_SUCCEEDED, null, requestId, correlationId,
                providerId, credentialId, null, null, null, latency, attempt, null);
    }

    public static RoutingEvent attemptFailed(
            String requestId, String correlationId, String providerId, String credentialId,
            FailureCause cause, Duration latency, int attempt, String message
    ) {
        return new RoutingEvent(RoutingEventType.ATTEMPT_FAILED, null, requestId, correlationId,
                providerId, credentialId, cause, null, null, latency, attempt, message);
    }

    public static RoutingEvent routeSucceeded(
            String requestId, String correlationId, String providerId, Duration latency, int attempts
    ) {
        return new RoutingEvent(RoutingEventType.ROUTE_SUCCEEDED, null, requestId, correlationId,
                providerId, null, null, null, null, latency, attempts, null);
    }

    public static RoutingEvent routeExhausted(
            String requestId, String correlationId, FailureCause lastCause, Duration latency, int attempts
    ) {
        return new RoutingEvent(RoutingEventType.ROUTE_EXHAUSTED, null, requestId, correlationId,
                null, null, lastCause, null, null, latency, attempts, null);
    }

    public static RoutingEvent noEligibleProvider(String requestId, String correlationId, String message) {
        return new RoutingEvent(RoutingEventType.NO_ELIGIBLE_PROVIDER, null, requestId, correlationId,
                null, null, null, null, null, null, 0, message);
    }

    public static RoutingEvent noCredentialAvailable(String requestId, String correlationId, String message) {
        return new RoutingEvent(RoutingEventType.NO_CREDENTIAL_AVAILABLE, null, requestId, correlationId,
                null, null, null, null, null, null, 0, message);
    }

    public static RoutingEvent circuitTransition(
            String providerId, CircuitState from, CircuitState to, int failureStreak, Instant at
    ) {
        return new RoutingEvent(RoutingEventType.CIRCUIT_TRANSITION, at, null, null,
                providerId, null, null, from, to, null, failureStreak, null);
    }

    public static RoutingEvent credentialAuthFailure(
            String requestId, String correlationId, String providerId, String credentialId, String message
    ) {
        return new RoutingEvent(RoutingEventType.CREDENTIAL_AUTH_FAILURE, null, requestId, correlationId,
                providerId, credentialId, FailureCause.AUTH_ERROR, null, null, null, 0, message);
    }

    public static RoutingEvent providerReset(String providerId) {
        return new RoutingEvent(RoutingEventType.PROVIDER_RESET, null, null, null,
                providerId, null, null, null, CircuitState.CLOSED, null, 0, null);
    }

    public static RoutingEvent configReloaded(long generation, int providerCount) {
        return new RoutingEvent(RoutingEventType.CONFIG_RELOADED, null, null, null,
                null, null, null, null, null, null, providerCount, "generation=" + generation);
    }

    public static RoutingEvent configRejected(String message) {
        return new RoutingEvent(RoutingEventType.CONFIG_REJECTED, null, null, null,
                null, null, null, null, null, null, 0, message);
    }
}
