package fr.lapetina.aimux.domain.strategy;

import fr.lapetina.aimux.domain.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active strategy and applies it. The strategy can be swapped at runtime;
 * a selection in progress finishes with the strategy it started with.
 */
public final class LoadBalancer {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final AtomicReference<LoadBalancingStrategy> strategyRef;

    public LoadBalancer(LoadBalancingStrategy initialStrategy) {
        this.strategyRef = new AtomicReference<>(
                Objects.requireNonNull(initialStrategy, "Initial strategy is required"));
    }

    public Optional<Provider> select(List<Candidate> candidates) {
        LoadBalancingStrategy strategy = strategyRef.get();
        Optional<Provider> selected = strategy.select(candidates);
        if (log.isDebugEnabled()) {
            log.debug("Provider selected: strategy={}, candidates={}, selected={}",
                    strategy.getName(),
                    candidates.size(),
                    selected.map(Provider::getId).orElse("none"));
        }
        return selected;
    }

    /**
     * Changes the strategy at runtime.
     */
    public void setStrategy(LoadBalancingStrategy strategy) {
        Objects.requireNonNull(strategy, "Strategy is required");
        LoadBalancingStrategy old = strategyRef.getAndSet(strategy);
        if (old != strategy) {
            log.info("Load balancing strategy changed: {} -> {}", old.getName(), strategy.getName());
        }
    }

    public LoadBalancingStrategy getStrategy() {
        return strategyRef.get();
    }

    /**
     * Resets state of the active strategy, for example after the provider set changed.
     */
    public void reset() {
        strategyRef.get().reset();
    }
}
