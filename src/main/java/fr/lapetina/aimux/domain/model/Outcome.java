package fr.lapetina.aimux.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of one dispatch attempt, written back into credential, health and
 * performance state. A failed outcome always carries a cause.
 */
public record Outcome(
        boolean success,
        FailureCause cause,
        Duration latency,
        String message
) {
    public Outcome {
        if (success && cause != null) {
            throw new IllegalArgumentException("Successful outcome cannot carry a failure cause");
        }
        if (!success) {
            Objects.requireNonNull(cause, "Failure cause is required");
        }
        latency = latency != null ? latency : Duration.ZERO;
        if (latency.isNegative()) {
            latency = Duration.ZERO;
        }
    }

    public static Outcome success(Duration latency) {
        return new Outcome(true, null, latency, null);
    }

    public static Outcome failure(FailureCause cause, Duration latency, String message) {
        return new Outcome(false, cause, latency, message);
    }

    public boolean isFailure() {
        return !success;
    }
}
