package fr.lapetina.aimux.infrastructure.registry;

import fr.lapetina.aimux.domain.bridge.Bridge;
import fr.lapetina.aimux.domain.bridge.BridgeCatalog;
import fr.lapetina.aimux.domain.bridge.ProviderDescriptor;
import fr.lapetina.aimux.domain.event.RoutingEvent;
import fr.lapetina.aimux.domain.event.RoutingEventSink;
import fr.lapetina.aimux.domain.model.Capability;
import fr.lapetina.aimux.domain.model.CostClass;
import fr.lapetina.aimux.domain.model.CredentialRef;
import fr.lapetina.aimux.domain.model.FailureCause;
import fr.lapetina.aimux.domain.model.Outcome;
import fr.lapetina.aimux.domain.model.Provider;
import fr.lapetina.aimux.domain.model.SpeedClass;
import fr.lapetina.aimux.domain.strategy.Candidate;
import fr.lapetina.aimux.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.aimux.infrastructure.config.ConfigValidator;
import fr.lapetina.aimux.infrastructure.config.RouterConfig;
import fr.lapetina.aimux.infrastructure.health.CircuitBreaker;
import fr.lapetina.aimux.infrastructure.health.DispatchPermit;
import fr.lapetina.aimux.infrastructure.health.HealthMonitor;
import fr.lapetina.aimux.infrastructure.health.HealthPolicy;
import fr.lapetina.aimux.infrastructure.health.HealthState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Registry of configured providers and their runtime state.
 *
 * <p>Provider identity lives in an immutable {@link RegistrySnapshot} behind an atomic reference;
 * a reload builds a new snapshot off the hot path and swaps it in one step. Circuit state,
 * latency windows and credential windows are per-provider objects carried into the new snapshot
 * for ids that survive.
 *
 * <p>All read and outcome methods are safe for concurrent use and never do I/O.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final BridgeCatalog bridgeCatalog;
    private final HealthMonitor healthMonitor;
    private final RoutingEventSink events;
    private final Clock clock;
    private final Function<String, String> environment;
    private final AtomicReference<RegistrySnapshot> current;
    private final Object reloadLock = new Object();

    public ProviderRegistry(
            BridgeCatalog bridgeCatalog,
            HealthMonitor healthMonitor,
            RoutingEventSink events,
            Clock clock,
            Function<String, String> environment
    ) {
        this.bridgeCatalog = Objects.requireNonNull(bridgeCatalog, "Bridge catalog is required");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "Health monitor is required");
        this.events = events != null ? events : RoutingEventSink.noop();
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.environment = Objects.requireNonNull(environment, "Environment lookup is required");
        this.current = new AtomicReference<>(RegistrySnapshot.empty(clock.instant()));
    }

    public ProviderRegistry(
            BridgeCatalog bridgeCatalog,
            HealthMonitor healthMonitor,
            RoutingEventSink events,
            Clock clock
    ) {
        this(bridgeCatalog, healthMonitor, events, clock, System::getenv);
    }

    // ==================== READS ====================

    public RegistrySnapshot currentSnapshot() {
        return current.get();
    }

    public long getGeneration() {
        return current.get().getGeneration();
    }

    public Optional<ProviderEntry> find(String providerId) {
        return current.get().find(providerId);
    }

    /**
     * Providers that can take a request with the given capabilities right now, in configuration order.
     */
    public List<Provider> eligibleProviders(Set<Capability> requiredCapabilities) {
        return eligibleProviders(current.get(), requiredCapabilities);
    }

    public List<Provider> eligibleProviders(RegistrySnapshot snapshot, Set<Capability> requiredCapabilities) {
        Instant now = clock.instant();
        List<Provider> eligible = new ArrayList<>();
        for (ProviderEntry entry : snapshot.entries()) {
            if (isAvailable(entry, now) && entry.getProvider().supports(requiredCapabilities)) {
                eligible.add(entry.getProvider());
            }
        }
        return eligible;
    }

    /**
     * Providers that would be eligible if any of their keys had quota left.
     */
    public List<Provider> quotaExhaustedProviders(RegistrySnapshot snapshot, Set<Capability> requiredCapabilities) {
        Instant now = clock.instant();
        List<Provider> exhausted = new ArrayList<>();
        for (ProviderEntry entry : snapshot.entries()) {
            if (entry.getProvider().isEnabled()
                    && entry.hasCredentials()
                    && entry.getCircuitBreaker().isDispatchable()
                    && !entry.getCredentials().hasCapacity(now)
                    && entry.getProvider().supports(requiredCapabilities)) {
                exhausted.add(entry.getProvider());
            }
        }
        return exhausted;
    }

    private boolean isAvailable(ProviderEntry entry, Instant now) {
        return entry.getProvider().isEnabled()
                && entry.hasCredentials()
                && entry.getCircuitBreaker().isDispatchable()
                && entry.getCredentials().hasCapacity(now);
    }

    /**
     * Attaches recent latency data to providers for the selection strategy.
     */
    public List<Candidate> candidates(RegistrySnapshot snapshot, Collection<Provider> providers) {
        List<Candidate> candidates = new ArrayList<>(providers.size());
        for (Provider provider : providers) {
            Optional<ProviderEntry> entry = snapshot.find(provider.getId());
            if (entry.isPresent()) {
                PerformanceStats stats = entry.get().getPerformanceStats();
                candidates.add(new Candidate(provider, stats.meanLatencyMs(), stats.sampleCount()));
            } else {
                candidates.add(Candidate.cold(provider));
            }
        }
        return candidates;
    }

    // ==================== DISPATCH GATE ====================

    /**
     * Health gate applied right before dispatch. Performs the lazy open to half-open
     * transition and claims the single probe slot when the circuit is not closed.
     *
     * @return the permit to report the outcome with, or empty when the provider must be skipped
     */
    public Optional<DispatchPermit> tryAcquireDispatch(String providerId) {
        return tryAcquireDispatch(current.get(), providerId);
    }

    public Optional<DispatchPermit> tryAcquireDispatch(RegistrySnapshot snapshot, String providerId) {
        Optional<ProviderEntry> entry = snapshot.find(providerId);
        if (entry.isEmpty() || !entry.get().hasCredentials()) {
            return Optional.empty();
        }
        return entry.get().getCircuitBreaker().tryAcquireDispatch();
    }

    /**
     * Returns a permit obtained from {@link #tryAcquireDispatch} that was not used.
     */
    public void releaseDispatch(DispatchPermit permit) {
        releaseDispatch(current.get(), permit);
    }

    public void releaseDispatch(RegistrySnapshot snapshot, DispatchPermit permit) {
        snapshot.find(permit.providerId()).ifPresent(entry -> entry.getCircuitBreaker().releaseProbe(permit));
    }

    // ==================== CREDENTIALS ====================

    /**
     * Reserves one request of quota on the provider's current key, rotating when it is exhausted.
     *
     * @return the reserved key, or empty when every key of the provider is at quota
     */
    public Optional<CredentialRef> acquireCredential(String providerId) {
        return acquireCredential(current.get(), providerId);
    }

    public Optional<CredentialRef> acquireCredential(RegistrySnapshot snapshot, String providerId) {
        Optional<ProviderEntry> entry = snapshot.find(providerId);
        if (entry.isEmpty()) {
            log.debug("Credential requested for unknown provider: providerId={}", providerId);
            return Optional.empty();
        }
        return entry.get().getCredentials()
                .acquire(clock.instant())
                .map(CredentialSlot::toRef);
    }

    /**
     * Gives back a reservation taken by {@link #acquireCredential} for a request that was never sent.
     */
    public void releaseCredential(RegistrySnapshot snapshot, String providerId, String credentialId) {
        Optional<CredentialSlot> slot = snapshot.find(providerId)
                .flatMap(entry -> entry.getCredentials().find(credentialId));
        if (slot.isEmpty()) {
            log.warn("Reservation for unknown credential not returned: providerId={}, credentialId={}",
                    providerId, credentialId);
            return;
        }
        slot.get().cancelReservation(clock.instant());
    }

    /**
     * Writes the outcome of a dispatch made without a permit back into credential,
     * latency and circuit state. Never throws; unknown ids are logged and ignored.
     */
    public void releaseOutcome(String providerId, String credentialId, Outcome outcome) {
        applyOutcome(current.get(), providerId, null, credentialId, outcome);
    }

    /**
     * Writes an attempt outcome back under the permit it was dispatched with.
     * Never throws; unknown ids are logged and ignored.
     */
    public void releaseOutcome(RegistrySnapshot snapshot, DispatchPermit permit, String credentialId, Outcome outcome) {
        applyOutcome(snapshot, permit.providerId(), permit, credentialId, outcome);
    }

    private void applyOutcome(RegistrySnapshot snapshot, String providerId, DispatchPermit permit,
                              String credentialId, Outcome outcome) {
        if (outcome == null) {
            log.warn("Null outcome ignored: providerId={}, credentialId={}", providerId, credentialId);
            if (permit != null) {
                releaseDispatch(snapshot, permit);
            }
            return;
        }
        Optional<ProviderEntry> found = snapshot.find(providerId);
        if (found.isEmpty()) {
            log.warn("Outcome for unknown provider ignored: providerId={}, credentialId={}", providerId, credentialId);
            return;
        }
        ProviderEntry entry = found.get();
        try {
            if (outcome.cause() != FailureCause.DEADLINE_EXCEEDED) {
                entry.getPerformanceStats().record(outcome);
            }

            Optional<CredentialSlot> slot = entry.getCredentials().find(credentialId);
            if (slot.isEmpty()) {
                log.warn("Outcome for unknown credential: providerId={}, credentialId={}", providerId, credentialId);
            } else if (outcome.success()) {
                slot.get().recordSuccess();
            } else {
                slot.get().recordFailure();
                if (outcome.cause() == FailureCause.RATE_LIMITED) {
                    slot.get().markExhausted(clock.instant());
                    log.info("Credential rate limited, skipped until window ends: providerId={}, credentialId={}",
                            providerId, credentialId);
                } else if (outcome.cause() == FailureCause.AUTH_ERROR
                        && entry.getCredentials().rotatePast(slot.get())) {
                    log.info("Credential rejected, rotated to next key: providerId={}, credentialId={}",
                            providerId, credentialId);
                }
            }

            healthMonitor.record(entry.getCircuitBreaker(), permit, outcome);
        } catch (RuntimeException e) {
            log.error("Failed to apply outcome: providerId={}, credentialId={}, outcome={}",
                    providerId, credentialId, outcome, e);
        }
    }

    // ==================== ADMIN ====================

    /**
     * Clears circuit state and latency window of a provider.
     *
     * @return false if the provider is unknown
     */
    public boolean resetProvider(String providerId) {
        Optional<ProviderEntry> entry = current.get().find(providerId);
        if (entry.isEmpty()) {
            return false;
        }
        entry.get().getCircuitBreaker().reset();
        entry.get().getPerformanceStats().reset();
        log.info("Provider reset: providerId={}", providerId);
        events.emit(RoutingEvent.providerReset(providerId));
        return true;
    }

    /**
     * Read-only view of every provider. Secrets are masked.
     */
    public RegistryStatus snapshot() {
        RegistrySnapshot snapshot = current.get();
        Instant now = clock.instant();
        List<RegistryStatus.ProviderStatus> providers = new ArrayList<>(snapshot.size());
        for (ProviderEntry entry : snapshot.entries()) {
            providers.add(toStatus(entry, now));
        }
        return new RegistryStatus(snapshot.getGeneration(), now, providers);
    }

    private RegistryStatus.ProviderStatus toStatus(ProviderEntry entry, Instant now) {
        Provider provider = entry.getProvider();
        HealthState health = entry.getCircuitBreaker().getHealthState();

        List<String> capabilities = new ArrayList<>();
        for (Capability capability : provider.getCapabilities()) {
            capabilities.add(capability.getKey());
        }

        CredentialPool pool = entry.getCredentials();
        CredentialSlot currentSlot = pool.isEmpty() ? null : pool.currentSlot();
        List<RegistryStatus.CredentialStatus> credentials = new ArrayList<>(pool.size());
        for (CredentialSlot slot : pool.getSlots()) {
            credentials.add(new RegistryStatus.CredentialStatus(
                    slot.getCredentialId(),
                    slot.toRef().maskedSecret(),
                    slot == currentSlot,
                    slot.usedInWindow(now),
                    slot.getQuota(),
                    slot.windowStart(),
                    slot.getConsecutiveFailures(),
                    slot.getLastUsed()
            ));
        }

        return new RegistryStatus.ProviderStatus(
                provider.getId(),
                provider.getDisplayName(),
                provider.getBridgeType(),
                capabilities,
                provider.getCostClass().name(),
                provider.getSpeedClass().name(),
                provider.getPriority(),
                provider.isEnabled(),
                isAvailable(entry, now),
                new RegistryStatus.HealthView(
                        health.state(),
                        health.failureStreak(),
                        health.probeSuccesses(),
                        health.probeInFlight(),
                        health.cooldown().toMillis(),
                        health.lastTransition(),
                        health.nextRetryAt()
                ),
                credentials,
                entry.getPerformanceStats().view()
        );
    }

    // ==================== RELOAD ====================

    /**
     * Validates a configuration, builds a new snapshot and swaps it in atomically.
     * Routing decisions in progress finish on the snapshot they started with.
     *
     * @throws ConfigurationException if the configuration is invalid; the current snapshot is kept
     */
    public void reload(RouterConfig config) {
        synchronized (reloadLock) {
            RegistrySnapshot previous = current.get();
            HealthPolicy policy;
            RegistrySnapshot next;
            try {
                ConfigValidator.validate(config, bridgeCatalog);
                policy = config.getHealthCheck().toPolicy();
                next = buildSnapshot(config, previous, policy);
            } catch (ConfigurationException e) {
                log.error("Configuration rejected, keeping generation {}: {}", previous.getGeneration(), e.getMessage());
                events.emit(RoutingEvent.configRejected(e.getMessage()));
                throw e;
            }

            healthMonitor.setPolicy(policy);
            for (ProviderEntry entry : next.entries()) {
                entry.getCircuitBreaker().updatePolicy(policy);
            }
            current.set(next);

            log.info("Provider registry reloaded: generation={}, providers={}, previousProviders={}",
                    next.getGeneration(), next.size(), previous.size());
            events.emit(RoutingEvent.configReloaded(next.getGeneration(), next.size()));
        }
    }

    private RegistrySnapshot buildSnapshot(RouterConfig config, RegistrySnapshot previous, HealthPolicy policy) {
        Instant now = clock.instant();
        int windowSize = config.getPerformance().getWindowSize();
        Map<String, ProviderEntry> entries = new LinkedHashMap<>();

        for (RouterConfig.ProviderConfig providerConfig : config.getProviders()) {
            String id = providerConfig.getId();
            ProviderEntry old = previous.find(id).orElse(null);
            Map<String, Object> settings = providerConfig.getSettings() != null
                    ? new LinkedHashMap<>(providerConfig.getSettings())
                    : new LinkedHashMap<>();

            Bridge bridge;
            if (old != null
                    && providerConfig.getBridge().equalsIgnoreCase(old.getProvider().getBridgeType())
                    && settings.equals(old.getBridgeSettings())) {
                bridge = old.getBridge();
            } else {
                bridge = createBridge(providerConfig, settings);
            }

            Provider provider = buildProvider(providerConfig, bridge);
            CredentialPool pool = buildCredentialPool(providerConfig, provider, old, now);

            CircuitBreaker breaker;
            if (old != null) {
                breaker = old.getCircuitBreaker();
            } else {
                breaker = healthMonitor.newCircuitBreaker(id);
                breaker.updatePolicy(policy);
            }

            PerformanceStats stats = old != null && old.getPerformanceStats().getWindowSize() == windowSize
                    ? old.getPerformanceStats()
                    : new PerformanceStats(windowSize);

            if (pool.isEmpty()) {
                log.warn("Provider has no credentials and will never be eligible: providerId={}", id);
            }

            entries.put(id, new ProviderEntry(provider, bridge, settings, pool, breaker, stats));
        }

        return new RegistrySnapshot(previous.getGeneration() + 1, entries, now);
    }

    private Bridge createBridge(RouterConfig.ProviderConfig providerConfig, Map<String, Object> settings) {
        try {
            return bridgeCatalog.create(providerConfig.getBridge(), providerConfig.getId(), settings);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Failed to create bridge for provider "
                    + providerConfig.getId() + ": " + e.getMessage(), e);
        }
    }

    private Provider buildProvider(RouterConfig.ProviderConfig providerConfig, Bridge bridge) {
        boolean needsDescriptor = providerConfig.getCapabilities() == null
                || providerConfig.getCostClass() == null
                || providerConfig.getSpeedClass() == null;
        ProviderDescriptor descriptor = needsDescriptor ? describe(providerConfig.getId(), bridge) : null;

        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (providerConfig.getCapabilities() != null) {
            for (String name : providerConfig.getCapabilities()) {
                Capability.fromKey(name).ifPresent(capabilities::add);
            }
        } else {
            capabilities.addAll(descriptor.capabilities());
        }

        CostClass costClass = providerConfig.getCostClass() != null
                ? CostClass.fromName(providerConfig.getCostClass()).orElseThrow()
                : descriptor.costClass();
        SpeedClass speedClass = providerConfig.getSpeedClass() != null
                ? SpeedClass.fromName(providerConfig.getSpeedClass()).orElseThrow()
                : descriptor.speedClass();

        return Provider.builder()
                .id(providerConfig.getId())
                .displayName(providerConfig.getDisplayName())
                .capabilities(capabilities)
                .costClass(costClass)
                .speedClass(speedClass)
                .priority(providerConfig.getPriority())
                .requestsPerWindow(providerConfig.getRequestsPerWindow())
                .rateWindow(Duration.ofMillis(providerConfig.getRateWindowMs()))
                .bridgeType(providerConfig.getBridge())
                .enabled(providerConfig.isEnabled())
                .build();
    }

    private ProviderDescriptor describe(String providerId, Bridge bridge) {
        ProviderDescriptor descriptor;
        try {
            descriptor = bridge.describe();
        } catch (RuntimeException e) {
            throw new ConfigurationException("Bridge describe() failed for provider " + providerId
                    + ": " + e.getMessage(), e);
        }
        if (descriptor == null) {
            log.warn("Bridge returned no description, assuming text only: providerId={}", providerId);
            return ProviderDescriptor.textOnly();
        }
        return descriptor;
    }

    private CredentialPool buildCredentialPool(
            RouterConfig.ProviderConfig providerConfig,
            Provider provider,
            ProviderEntry old,
            Instant now
    ) {
        List<CredentialSlot> slots = new ArrayList<>();
        List<RouterConfig.CredentialConfig> credentials = providerConfig.getCredentials() != null
                ? providerConfig.getCredentials()
                : List.of();

        for (RouterConfig.CredentialConfig credentialConfig : credentials) {
            String secret = resolveSecret(provider.getId(), credentialConfig);
            CredentialSlot previous = old != null
                    ? old.getCredentials().find(credentialConfig.getId()).orElse(null)
                    : null;

            if (previous != null
                    && previous.getQuota() == provider.getRequestsPerWindow()
                    && old.getProvider().getRateWindow().equals(provider.getRateWindow())
                    && Objects.equals(previous.toRef().secret(), secret)) {
                slots.add(previous);
                continue;
            }

            CredentialSlot slot = new CredentialSlot(
                    provider.getId(), credentialConfig.getId(), secret,
                    provider.getRequestsPerWindow(), provider.getRateWindow(), now);
            if (previous != null) {
                slot.carryOver(previous);
            }
            slots.add(slot);
        }

        CredentialPool pool = new CredentialPool(slots);
        if (old != null) {
            pool.carryOverCurrent(old.getCredentials());
        }
        return pool;
    }

    private String resolveSecret(String providerId, RouterConfig.CredentialConfig credentialConfig) {
        if (credentialConfig.getSecret() != null && !credentialConfig.getSecret().isBlank()) {
            return credentialConfig.getSecret();
        }
        String variable = credentialConfig.getSecretEnv();
        String value = environment.apply(variable);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Environment variable " + variable + " for credential "
                    + credentialConfig.getId() + " of provider " + providerId + " is not set");
        }
        return value;
    }
}
