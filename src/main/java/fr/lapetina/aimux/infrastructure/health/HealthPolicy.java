package fr.lapetina.aimux.infrastructure.health;

import java.time.Duration;
import java.util.Objects;

/**
 * Circuit breaker thresholds.
 *
 * @param failureThreshold consecutive failures that open a closed circuit
 * @param successThreshold consecutive probe successes that close a half-open circuit
 * @param cooldown         initial open duration before a probe is allowed
 * @param maxCooldown      cap for the doubling applied after each failed probe
 */
public record HealthPolicy(
        int failureThreshold,
        int successThreshold,
        Duration cooldown,
        Duration maxCooldown
) {
    public HealthPolicy {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1: " + successThreshold);
        }
        Objects.requireNonNull(cooldown, "Cooldown is required");
        Objects.requireNonNull(maxCooldown, "Max cooldown is required");
        if (cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive: " + cooldown);
        }
        if (maxCooldown.compareTo(cooldown) < 0) {
            throw new IllegalArgumentException("maxCooldown must be >= cooldown: " + maxCooldown);
        }
    }

    public static HealthPolicy defaults() {
        return new HealthPolicy(5, 3, Duration.ofSeconds(30), Duration.ofMinutes(5));
    }

    Duration nextCooldown(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(maxCooldown) > 0 ? maxCooldown : doubled;
    }
}
