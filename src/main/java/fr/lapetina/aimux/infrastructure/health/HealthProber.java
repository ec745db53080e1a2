package fr.lapetina.aimux.infrastructure.health;

import fr.lapetina.aimux.infrastructure.registry.ProviderEntry;
import fr.lapetina.aimux.infrastructure.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background prober for providers with an open or half-open circuit.
 *
 * Periodically claims the probe slot of each provider whose slot is grantable and calls
 * {@code Bridge.healthProbe()}. The result goes through the same transitions as a routed
 * attempt: true counts as a probe success; false, an exception or a timeout as a probe failure.
 * Closed circuits are left alone.
 */
public final class HealthProber implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthProber.class);

    private final ProviderRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService probeExecutor;
    private final Duration probeInterval;
    private final Duration probeTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthProber(ProviderRegistry registry, Duration probeInterval, Duration probeTimeout) {
        this.registry = registry;
        this.probeInterval = probeInterval;
        this.probeTimeout = probeTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-prober");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger counter = new AtomicInteger(0);
        this.probeExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "health-probe-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts periodic probing. Does nothing when the interval is zero.
     */
    public void start() {
        if (probeInterval.isZero() || probeInterval.isNegative()) {
            log.info("Active health probing disabled");
            return;
        }
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::probeAll,
                    probeInterval.toMillis(),
                    probeInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health prober started: interval={}, timeout={}", probeInterval, probeTimeout);
        }
    }

    /**
     * Probes every provider whose probe slot can be claimed right now.
     *
     * @return number of probes performed
     */
    public int probeAll() {
        int probed = 0;
        try {
            for (ProviderEntry entry : registry.currentSnapshot().entries()) {
                if (entry.hasCredentials() && probe(entry)) {
                    probed++;
                }
            }
        } catch (RuntimeException e) {
            log.error("Error during health probe cycle", e);
        }
        return probed;
    }

    /**
     * Probes one provider if its probe slot can be claimed.
     *
     * @return true if a probe was performed
     */
    public boolean probe(ProviderEntry entry) {
        CircuitBreaker breaker = entry.getCircuitBreaker();
        Optional<DispatchPermit> claimed = breaker.tryAcquireProbe();
        if (claimed.isEmpty()) {
            return false;
        }
        DispatchPermit permit = claimed.get();

        log.debug("Health probe started: providerId={}, state={}", entry.getId(), breaker.getState());

        Future<Boolean> future;
        try {
            future = probeExecutor.submit(() -> entry.getBridge().healthProbe());
        } catch (RuntimeException e) {
            breaker.releaseProbe(permit);
            log.warn("Health probe could not be scheduled: providerId={}, error={}", entry.getId(), e.getMessage());
            return false;
        }

        boolean healthy;
        String failure = null;
        try {
            healthy = Boolean.TRUE.equals(future.get(probeTimeout.toMillis(), TimeUnit.MILLISECONDS));
            if (!healthy) {
                failure = "probe returned false";
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            healthy = false;
            failure = "probe timed out after " + probeTimeout.toMillis() + "ms";
        } catch (ExecutionException e) {
            healthy = false;
            failure = String.valueOf(e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            breaker.releaseProbe(permit);
            Thread.currentThread().interrupt();
            return false;
        }

        if (healthy) {
            breaker.recordSuccess(permit);
            log.info("Health probe passed: providerId={}, state={}", entry.getId(), breaker.getState());
        } else {
            breaker.recordFailure(permit);
            log.warn("Health probe failed: providerId={}, state={}, error={}",
                    entry.getId(), breaker.getState(), failure);
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        probeExecutor.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health prober stopped");
    }
}
