package fr.lapetina.aimux.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Successful routing result: the first provider response, plus the failed attempts that preceded it.
 */
public record RouteResponse(
        String requestId,
        String providerId,
        String credentialId,
        Object body,
        Map<String, Object> metadata,
        Duration latency,
        List<AttemptRecord> failedAttempts,
        Instant completedAt
) {
    public RouteResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(providerId, "Provider ID is required");
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
        failedAttempts = failedAttempts != null ? List.copyOf(failedAttempts) : List.of();
        if (completedAt == null) {
            completedAt = Instant.now();
        }
    }

    /**
     * Number of dispatches made for this request, including the successful one.
     */
    public int attemptCount() {
        return failedAttempts.size() + 1;
    }
}
