package fr.lapetina.aimux.domain.strategy;

import fr.lapetina.aimux.domain.model.Provider;

import java.util.Objects;

/**
 * A provider offered to a strategy together with its recent latency view.
 *
 * @param meanLatencyMs mean of the recent successful latencies, NaN when there are no samples
 * @param sampleCount   number of latency samples behind the mean
 */
public record Candidate(Provider provider, double meanLatencyMs, int sampleCount) {

    public Candidate {
        Objects.requireNonNull(provider, "Provider is required");
    }

    public static Candidate cold(Provider provider) {
        return new Candidate(provider, Double.NaN, 0);
    }

    public boolean hasSamples() {
        return sampleCount > 0 && !Double.isNaN(meanLatencyMs);
    }

    public String id() {
        return provider.getId();
    }
}
