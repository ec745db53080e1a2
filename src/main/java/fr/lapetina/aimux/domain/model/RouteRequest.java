package fr.lapetina.aimux.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * A request to be routed to one provider.
 * Immutable and thread-safe; the payload is opaque to the router and handed to the bridge as is.
 *
 * @param maxLatency optional overall deadline for the whole routing decision, null for none
 */
public record RouteRequest(
        String requestId,
        Set<Capability> requiredCapabilities,
        Duration maxLatency,
        Object payload,
        String idempotencyKey,
        Instant createdAt,
        String correlationId
) {
    public RouteRequest {
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (correlationId == null) {
            correlationId = requestId;
        }
        if (maxLatency != null && (maxLatency.isNegative() || maxLatency.isZero())) {
            throw new IllegalArgumentException("maxLatency must be positive: " + maxLatency);
        }
        requiredCapabilities = requiredCapabilities == null || requiredCapabilities.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(requiredCapabilities));
    }

    /**
     * Creates a request that any provider with the given capabilities can serve.
     */
    public static RouteRequest of(Object payload, Capability... required) {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        Collections.addAll(capabilities, required);
        return new RouteRequest(null, capabilities, null, payload, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private final Set<Capability> requiredCapabilities = EnumSet.noneOf(Capability.class);
        private Duration maxLatency;
        private Object payload;
        private String idempotencyKey;
        private Instant createdAt;
        private String correlationId;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder require(Capability capability) {
            this.requiredCapabilities.add(capability);
            return this;
        }

        public Builder requiredCapabilities(Collection<Capability> capabilities) {
            this.requiredCapabilities.addAll(capabilities);
            return this;
        }

        public Builder maxLatency(Duration maxLatency) {
            this.maxLatency = maxLatency;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public RouteRequest build() {
            return new RouteRequest(
                    requestId, requiredCapabilities, maxLatency, payload,
                    idempotencyKey, createdAt, correlationId
            );
        }
    }
}
