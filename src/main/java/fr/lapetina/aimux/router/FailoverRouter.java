package fr.lapetina.aimux.router;

import fr.lapetina.aimux.domain.bridge.Bridge;
import fr.lapetina.aimux.domain.bridge.BridgeException;
import fr.lapetina.aimux.domain.bridge.BridgeResponse;
import fr.lapetina.aimux.domain.bridge.Dispatch;
import fr.lapetina.aimux.domain.event.RoutingEvent;
import fr.lapetina.aimux.domain.event.RoutingEventSink;
import fr.lapetina.aimux.domain.model.AttemptRecord;
import fr.lapetina.aimux.domain.model.CredentialRef;
import fr.lapetina.aimux.domain.model.FailureCause;
import fr.lapetina.aimux.domain.model.Outcome;
import fr.lapetina.aimux.domain.model.Provider;
import fr.lapetina.aimux.domain.model.RouteRequest;
import fr.lapetina.aimux.domain.model.RouteResponse;
import fr.lapetina.aimux.domain.strategy.LoadBalancer;
import fr.lapetina.aimux.infrastructure.health.DispatchPermit;
import fr.lapetina.aimux.infrastructure.registry.ProviderEntry;
import fr.lapetina.aimux.infrastructure.registry.ProviderRegistry;
import fr.lapetina.aimux.infrastructure.registry.RegistrySnapshot;
import fr.lapetina.aimux.router.exception.NoCredentialAvailableException;
import fr.lapetina.aimux.router.exception.NoCredentialAvailableException.SkipReason;
import fr.lapetina.aimux.router.exception.NoEligibleProviderException;
import fr.lapetina.aimux.router.exception.RoutingExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Routes one request at a time across the eligible providers, failing over until
 * one succeeds or the attempt budget, candidates or deadline run out.
 *
 * <p>Flow per request:
 * <pre>
 * eligible providers → select → health gate → credential → dispatch → outcome
 *          ^                                                           |
 *          +------------------- failure: next candidate ---------------+
 * </pre>
 *
 * <p>The whole decision runs against the registry snapshot that was current when it started,
 * so a concurrent reload never changes the candidate set mid-request. Bridges run on the
 * dispatch executor and the calling thread waits at most the attempt timeout for each.
 * Providers skipped at the health gate or for lack of quota do not count as attempts.
 *
 * <p>Thread-safe: {@link #route} is called concurrently from caller threads.
 */
public final class FailoverRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FailoverRouter.class);

    private final ProviderRegistry registry;
    private final LoadBalancer loadBalancer;
    private final ExecutorService dispatchExecutor;
    private final AtomicReference<FailoverPolicy> policy;
    private final RoutingEventSink events;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public FailoverRouter(
            ProviderRegistry registry,
            LoadBalancer loadBalancer,
            ExecutorService dispatchExecutor,
            FailoverPolicy policy,
            RoutingEventSink events,
            Clock clock
    ) {
        this.registry = Objects.requireNonNull(registry, "Registry is required");
        this.loadBalancer = Objects.requireNonNull(loadBalancer, "Load balancer is required");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "Dispatch executor is required");
        this.policy = new AtomicReference<>(Objects.requireNonNull(policy, "Failover policy is required"));
        this.events = events != null ? events : RoutingEventSink.noop();
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    /**
     * Cached pool of daemon threads for bridge calls.
     */
    public static ExecutorService newDispatchExecutor() {
        return Executors.newCachedThreadPool(new DispatchThreadFactory("router-dispatch"));
    }

    /**
     * Routes a request to the first provider that answers successfully.
     *
     * @throws NoEligibleProviderException    if no provider can serve the required capabilities
     * @throws NoCredentialAvailableException if every matching provider is at quota or was skipped for lack of quota
     * @throws RoutingExhaustedException      if every attempt failed or the deadline passed
     */
    public RouteResponse route(RouteRequest request) {
        Objects.requireNonNull(request, "Request is required");
        if (closed.get()) {
            throw new IllegalStateException("Router is closed");
        }

        FailoverPolicy currentPolicy = policy.get();
        RegistrySnapshot snapshot = registry.currentSnapshot();
        Instant startedAt = clock.instant();
        Duration deadline = request.maxLatency() != null ? request.maxLatency() : currentPolicy.requestDeadline();
        Instant deadlineAt = deadline != null ? startedAt.plus(deadline) : null;

        List<Provider> remaining = new ArrayList<>(
                registry.eligibleProviders(snapshot, request.requiredCapabilities()));
        if (remaining.isEmpty()) {
            Map<String, SkipReason> atQuota = new LinkedHashMap<>();
            for (Provider provider : registry.quotaExhaustedProviders(snapshot, request.requiredCapabilities())) {
                atQuota.put(provider.getId(), SkipReason.QUOTA_EXHAUSTED);
            }
            if (!atQuota.isEmpty()) {
                throw noDispatch(request, atQuota);
            }
            log.warn("No eligible provider: requestId={}, capabilities={}",
                    request.requestId(), request.requiredCapabilities());
            events.emit(RoutingEvent.noEligibleProvider(request.requestId(), request.correlationId(),
                    "capabilities=" + request.requiredCapabilities()));
            throw new NoEligibleProviderException(request.requestId(), request.requiredCapabilities());
        }

        int maxAttempts = currentPolicy.effectiveMaxAttempts(remaining.size());
        List<AttemptRecord> failures = new ArrayList<>();
        Map<String, SkipReason> skipped = new LinkedHashMap<>();
        int attempts = 0;

        log.debug("Routing request: requestId={}, eligible={}, maxAttempts={}, deadline={}",
                request.requestId(), remaining.size(), maxAttempts, deadline);

        while (attempts < maxAttempts && !remaining.isEmpty()) {
            Duration left = deadlineAt != null ? Duration.between(clock.instant(), deadlineAt) : null;
            if (left != null && (left.isNegative() || left.isZero())) {
                failures.add(AttemptRecord.deadline(attempts + 1, "Deadline of " + deadline + " passed"));
                break;
            }

            Optional<Provider> selected = loadBalancer.select(registry.candidates(snapshot, remaining));
            if (selected.isEmpty()) {
                break;
            }
            Provider provider = selected.get();
            String providerId = provider.getId();

            // Health gate: lazy OPEN -> HALF_OPEN and probe slot claim
            Optional<DispatchPermit> gate = registry.tryAcquireDispatch(snapshot, providerId);
            if (gate.isEmpty()) {
                log.debug("Provider skipped at health gate: requestId={}, providerId={}",
                        request.requestId(), providerId);
                remaining.remove(provider);
                skipped.put(providerId, SkipReason.CIRCUIT_UNAVAILABLE);
                continue;
            }

            DispatchPermit permit = gate.get();

            Optional<CredentialRef> credential = registry.acquireCredential(snapshot, providerId);
            if (credential.isEmpty()) {
                registry.releaseDispatch(snapshot, permit);
                log.debug("Provider skipped, no credential under quota: requestId={}, providerId={}",
                        request.requestId(), providerId);
                remaining.remove(provider);
                skipped.put(providerId, SkipReason.QUOTA_EXHAUSTED);
                continue;
            }

            attempts++;
            CredentialRef ref = credential.get();
            Duration timeout = currentPolicy.attemptTimeout();
            boolean clamped = false;
            if (left != null && left.compareTo(timeout) < 0) {
                timeout = left;
                clamped = true;
            }

            AttemptResult result = dispatch(snapshot, permit, new Dispatch(request, ref, timeout), clamped);

            if (result.succeeded()) {
                registry.releaseOutcome(snapshot, permit, ref.credentialId(), Outcome.success(result.latency()));
                events.emit(RoutingEvent.attemptSucceeded(request.requestId(), request.correlationId(),
                        providerId, ref.credentialId(), result.latency(), attempts));

                Instant completedAt = clock.instant();
                Duration total = Duration.between(startedAt, completedAt);
                events.emit(RoutingEvent.routeSucceeded(request.requestId(), request.correlationId(),
                        providerId, total, attempts));
                log.debug("Request routed: requestId={}, providerId={}, attempts={}, latency={}",
                        request.requestId(), providerId, attempts, total);
                return new RouteResponse(request.requestId(), providerId, ref.credentialId(),
                        result.response().body(), result.response().metadata(), total, failures, completedAt);
            }

            FailureCause cause = result.cause();
            registry.releaseOutcome(snapshot, permit, ref.credentialId(),
                    Outcome.failure(cause, result.latency(), result.message()));
            failures.add(new AttemptRecord(attempts, providerId, ref.credentialId(), cause,
                    result.message(), result.latency()));
            events.emit(RoutingEvent.attemptFailed(request.requestId(), request.correlationId(),
                    providerId, ref.credentialId(), cause, result.latency(), attempts, result.message()));
            log.info("Attempt failed: requestId={}, providerId={}, credentialId={}, attempt={}, cause={}, message={}",
                    request.requestId(), providerId, ref.credentialId(), attempts, cause, result.message());

            if (cause == FailureCause.AUTH_ERROR) {
                log.warn("Credential rejected by provider: providerId={}, credentialId={}",
                        providerId, ref.credentialId());
                events.emit(RoutingEvent.credentialAuthFailure(request.requestId(), request.correlationId(),
                        providerId, ref.credentialId(), result.message()));
            }
            if (cause == FailureCause.DEADLINE_EXCEEDED || result.interrupted()) {
                break;
            }
            if (cause.dropsProvider()) {
                remaining.remove(provider);
            }
        }

        Duration total = Duration.between(startedAt, clock.instant());
        if (attempts == 0 && failures.isEmpty()) {
            throw noDispatch(request, skipped);
        }

        FailureCause lastCause = failures.get(failures.size() - 1).cause();
        log.warn("Routing exhausted: requestId={}, attempts={}, lastCause={}, latency={}",
                request.requestId(), attempts, lastCause, total);
        events.emit(RoutingEvent.routeExhausted(request.requestId(), request.correlationId(),
                lastCause, total, attempts));
        throw new RoutingExhaustedException(request.requestId(), failures);
    }

    /**
     * Every candidate was skipped before dispatch: a quota skip is transient, a circuit skip is not.
     */
    private RuntimeException noDispatch(RouteRequest request, Map<String, SkipReason> skipped) {
        if (skipped.containsValue(SkipReason.QUOTA_EXHAUSTED)) {
            log.warn("No credential available: requestId={}, skipped={}", request.requestId(), skipped);
            events.emit(RoutingEvent.noCredentialAvailable(request.requestId(), request.correlationId(),
                    "skipped=" + skipped));
            return new NoCredentialAvailableException(request.requestId(), skipped);
        }
        log.warn("No eligible provider after health gate: requestId={}, skipped={}",
                request.requestId(), skipped.keySet());
        events.emit(RoutingEvent.noEligibleProvider(request.requestId(), request.correlationId(),
                "skipped=" + skipped));
        return new NoEligibleProviderException(request.requestId(), request.requiredCapabilities());
    }

    private AttemptResult dispatch(RegistrySnapshot snapshot, DispatchPermit permit, Dispatch dispatch, boolean clamped) {
        String providerId = permit.providerId();
        Bridge bridge = snapshot.find(providerId)
                .map(ProviderEntry::getBridge)
                .orElseThrow(() -> new IllegalStateException("Provider missing from snapshot: " + providerId));

        Instant attemptStart = clock.instant();
        Future<BridgeResponse> future;
        try {
            future = dispatchExecutor.submit(() -> bridge.send(dispatch));
        } catch (RejectedExecutionException e) {
            String credentialId = dispatch.credential().credentialId();
            registry.releaseDispatch(snapshot, permit);
            registry.releaseCredential(snapshot, providerId, credentialId);
            log.error("Dispatch rejected, reservation returned: requestId={}, providerId={}, credentialId={}",
                    dispatch.request().requestId(), providerId, credentialId);
            throw new IllegalStateException("Dispatch executor rejected request " + dispatch.request().requestId(), e);
        }

        try {
            BridgeResponse response = future.get(dispatch.timeout().toNanos(), TimeUnit.NANOSECONDS);
            Duration latency = Duration.between(attemptStart, clock.instant());
            if (response == null) {
                return AttemptResult.failure(FailureCause.TRANSPORT_ERROR, "Bridge returned no response", latency);
            }
            return AttemptResult.success(response, latency);
        } catch (TimeoutException e) {
            future.cancel(true);
            Duration latency = Duration.between(attemptStart, clock.instant());
            return clamped
                    ? AttemptResult.failure(FailureCause.DEADLINE_EXCEEDED,
                            "Caller deadline expired after " + dispatch.timeout(), latency)
                    : AttemptResult.failure(FailureCause.TIMEOUT,
                            "No response within " + dispatch.timeout(), latency);
        } catch (ExecutionException e) {
            Duration latency = Duration.between(attemptStart, clock.instant());
            return classify(e.getCause(), latency);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            Duration latency = Duration.between(attemptStart, clock.instant());
            return AttemptResult.interrupted(latency);
        }
    }

    private static AttemptResult classify(Throwable error, Duration latency) {
        if (error instanceof BridgeException) {
            BridgeException bridgeException = (BridgeException) error;
            return AttemptResult.failure(bridgeException.getFailureCause(), bridgeException.getMessage(), latency);
        }
        String message = error != null
                ? error.getClass().getSimpleName() + ": " + error.getMessage()
                : "Unknown bridge failure";
        return AttemptResult.failure(FailureCause.TRANSPORT_ERROR, message, latency);
    }

    // ==================== POLICY ====================

    public FailoverPolicy getPolicy() {
        return policy.get();
    }

    public void setPolicy(FailoverPolicy newPolicy) {
        FailoverPolicy old = policy.getAndSet(Objects.requireNonNull(newPolicy, "Failover policy is required"));
        if (!old.equals(newPolicy)) {
            log.info("Failover policy changed: {} -> {}", old, newPolicy);
        }
    }

    public LoadBalancer getLoadBalancer() {
        return loadBalancer;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Shutting down FailoverRouter...");
            dispatchExecutor.shutdown();
            try {
                if (!dispatchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    dispatchExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                dispatchExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private record AttemptResult(
            BridgeResponse response,
            FailureCause cause,
            String message,
            Duration latency,
            boolean interrupted
    ) {
        static AttemptResult success(BridgeResponse response, Duration latency) {
            return new AttemptResult(response, null, null, latency, false);
        }

        static AttemptResult failure(FailureCause cause, String message, Duration latency) {
            return new AttemptResult(null, cause, message, latency, false);
        }

        static AttemptResult interrupted(Duration latency) {
            return new AttemptResult(null, FailureCause.DEADLINE_EXCEEDED, "Interrupted while waiting", latency, true);
        }

        boolean succeeded() {
            return response != null;
        }
    }

    private static class DispatchThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DispatchThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
