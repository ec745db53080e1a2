package fr.lapetina.aimux.router;

import fr.lapetina.aimux.infrastructure.config.RouterConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-request retry limits.
 *
 * @param maxAttempts     dispatches per request, 0 for "one per eligible provider"
 * @param maxAttemptsCap  hard upper bound applied after {@code maxAttempts} is resolved
 * @param attemptTimeout  how long a single dispatch may take
 * @param requestDeadline overall deadline when the request carries none, null for unlimited
 */
public record FailoverPolicy(
        int maxAttempts,
        int maxAttemptsCap,
        Duration attemptTimeout,
        Duration requestDeadline
) {
    public FailoverPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
        }
        if (maxAttemptsCap < 1) {
            throw new IllegalArgumentException("maxAttemptsCap must be >= 1: " + maxAttemptsCap);
        }
        Objects.requireNonNull(attemptTimeout, "Attempt timeout is required");
        if (attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new IllegalArgumentException("attemptTimeout must be positive: " + attemptTimeout);
        }
        if (requestDeadline != null && (requestDeadline.isNegative() || requestDeadline.isZero())) {
            requestDeadline = null;
        }
    }

    public static FailoverPolicy defaults() {
        return new FailoverPolicy(0, 5, Duration.ofSeconds(30), null);
    }

    public static FailoverPolicy fromConfig(RouterConfig.FailoverConfig config) {
        return new FailoverPolicy(
                config.getMaxAttempts(),
                config.getMaxAttemptsCap(),
                Duration.ofMillis(config.getAttemptTimeoutMs()),
                config.getRequestDeadlineMs() > 0 ? Duration.ofMillis(config.getRequestDeadlineMs()) : null
        );
    }

    /**
     * Resolves the attempt budget for a request with the given number of eligible providers.
     */
    public int effectiveMaxAttempts(int candidateCount) {
        int requested = maxAttempts == 0 ? candidateCount : maxAttempts;
        return Math.min(requested, maxAttemptsCap);
    }
}
