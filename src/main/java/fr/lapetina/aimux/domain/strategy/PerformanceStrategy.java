package fr.lapetina.aimux.domain.strategy;

import fr.lapetina.aimux.domain.model.Provider;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Lowest mean recent latency first.
 *
 * Providers without samples rank at the median of the sampled providers' means,
 * so a newly added provider is neither starved nor flooded. When no candidate has
 * samples the order falls back to priority weight.
 */
public final class PerformanceStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "performance";
    }

    @Override
    public Optional<Provider> select(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        double median = medianOfSampled(candidates);

        Comparator<Candidate> order = Comparator
                .comparingDouble((Candidate c) -> effectiveLatency(c, median))
                .thenComparing(CandidateOrdering.BY_PRIORITY_THEN_ID);

        return candidates.stream()
                .min(order)
                .map(Candidate::provider);
    }

    private static double effectiveLatency(Candidate candidate, double median) {
        return candidate.hasSamples() ? candidate.meanLatencyMs() : median;
    }

    static double medianOfSampled(List<Candidate> candidates) {
        double[] means = candidates.stream()
                .filter(Candidate::hasSamples)
                .mapToDouble(Candidate::meanLatencyMs)
                .toArray();
        if (means.length == 0) {
            // Every candidate compares equal, priority decides
            return 0.0;
        }
        Arrays.sort(means);
        int mid = means.length / 2;
        if (means.length % 2 == 1) {
            return means[mid];
        }
        return (means[mid - 1] + means[mid]) / 2.0;
    }
}
