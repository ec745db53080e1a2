package fr.lapetina.aimux.domain.strategy;

import fr.lapetina.aimux.domain.model.Provider;

import java.util.List;
import java.util.Optional;

/**
 * Picks one provider among eligible candidates.
 *
 * Implementations must be thread-safe, do no I/O and run in O(n log n) or better,
 * as they are called on every routing attempt from caller threads.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects a provider from the candidates.
     *
     * @param candidates eligible providers, in configuration order
     * @return the chosen provider, or empty if there are no candidates
     */
    Optional<Provider> select(List<Candidate> candidates);

    /**
     * Resets any internal state. Called when the provider set is reloaded.
     */
    default void reset() {
        // Default no-op
    }
}
