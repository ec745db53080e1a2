package fr.lapetina.aimux.domain.model;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Identity and static routing attributes of an AI provider.
 * Immutable once built; the registry replaces instances on reload.
 */
public final class Provider {
    private final String id;
    private final String displayName;
    private final Set<Capability> capabilities;
    private final CostClass costClass;
    private final SpeedClass speedClass;
    private final int priority;
    private final int requestsPerWindow;
    private final Duration rateWindow;
    private final String bridgeType;
    private final boolean enabled;

    private Provider(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Provider ID is required");
        this.displayName = builder.displayName != null ? builder.displayName : builder.id;
        this.capabilities = Collections.unmodifiableSet(EnumSet.copyOf(builder.capabilities));
        this.costClass = Objects.requireNonNull(builder.costClass, "Cost class is required");
        this.speedClass = Objects.requireNonNull(builder.speedClass, "Speed class is required");
        this.priority = builder.priority;
        if (builder.requestsPerWindow < 1) {
            throw new IllegalArgumentException("requestsPerWindow must be >= 1: " + builder.requestsPerWindow);
        }
        this.requestsPerWindow = builder.requestsPerWindow;
        this.rateWindow = Objects.requireNonNull(builder.rateWindow, "Rate window is required");
        if (rateWindow.isZero() || rateWindow.isNegative()) {
            throw new IllegalArgumentException("Rate window must be positive: " + rateWindow);
        }
        this.bridgeType = builder.bridgeType;
        this.enabled = builder.enabled;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Capabilities in declaration order of {@link Capability}.
     */
    public Set<Capability> getCapabilities() {
        return capabilities;
    }

    public boolean supports(Collection<Capability> required) {
        return required == null || capabilities.containsAll(required);
    }

    public CostClass getCostClass() {
        return costClass;
    }

    public SpeedClass getSpeedClass() {
        return speedClass;
    }

    /**
     * Static priority weight. Higher values are preferred on ties.
     */
    public int getPriority() {
        return priority;
    }

    public int getRequestsPerWindow() {
        return requestsPerWindow;
    }

    public Duration getRateWindow() {
        return rateWindow;
    }

    public String getBridgeType() {
        return bridgeType;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Provider that = (Provider) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Provider{" +
                "id='" + id + '\'' +
                ", capabilities=" + capabilities +
                ", cost=" + costClass +
                ", speed=" + speedClass +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String displayName;
        private final Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        private CostClass costClass = CostClass.MEDIUM;
        private SpeedClass speedClass = SpeedClass.MEDIUM;
        private int priority;
        private int requestsPerWindow = 60;
        private Duration rateWindow = Duration.ofSeconds(60);
        private String bridgeType;
        private boolean enabled = true;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder addCapability(Capability capability) {
            this.capabilities.add(capability);
            return this;
        }

        public Builder capabilities(Collection<Capability> capabilities) {
            this.capabilities.addAll(capabilities);
            return this;
        }

        public Builder costClass(CostClass costClass) {
            this.costClass = costClass;
            return this;
        }

        public Builder speedClass(SpeedClass speedClass) {
            this.speedClass = speedClass;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder requestsPerWindow(int requestsPerWindow) {
            this.requestsPerWindow = requestsPerWindow;
            return this;
        }

        public Builder rateWindow(Duration rateWindow) {
            this.rateWindow = rateWindow;
            return this;
        }

        public Builder bridgeType(String bridgeType) {
            this.bridgeType = bridgeType;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Provider build() {
            return new Provider(this);
        }
    }
}
