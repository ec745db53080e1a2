package fr.lapetina.aimux.domain.strategy;

import fr.lapetina.aimux.domain.model.Provider;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Cheapest cost class first, then priority weight.
 */
public final class CostStrategy implements LoadBalancingStrategy {

    private static final Comparator<Candidate> ORDER = Comparator
            .comparingInt((Candidate c) -> c.provider().getCostClass().rank())
            .thenComparing(CandidateOrdering.BY_PRIORITY_THEN_ID);

    @Override
    public String getName() {
        return "cost";
    }

    @Override
    public Optional<Provider> select(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return candidates.stream()
                .min(ORDER)
                .map(Candidate::provider);
    }
}
