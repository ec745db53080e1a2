package fr.lapetina.aimux.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * One failed step of a routing decision, in attempt order.
 * The provider and credential ids are null for a deadline that expired before any dispatch.
 */
public record AttemptRecord(
        int attempt,
        String providerId,
        String credentialId,
        FailureCause cause,
        String message,
        Duration latency
) {
    public AttemptRecord {
        Objects.requireNonNull(cause, "Cause is required");
        latency = latency != null ? latency : Duration.ZERO;
    }

    public static AttemptRecord deadline(int attempt, String message) {
        return new AttemptRecord(attempt, null, null, FailureCause.DEADLINE_EXCEEDED, message, Duration.ZERO);
    }
}
