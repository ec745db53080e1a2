package fr.lapetina.aimux.domain.strategy;

import fr.lapetina.aimux.domain.model.Provider;

import java.util.List;
import java.util.Optional;

/**
 * Default strategy: among providers that satisfy the required capabilities,
 * picks the highest static priority weight.
 */
public final class CapabilityStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "capability";
    }

    @Override
    public Optional<Provider> select(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return candidates.stream()
                .min(CandidateOrdering.BY_PRIORITY_THEN_ID)
                .map(Candidate::provider);
    }
}
