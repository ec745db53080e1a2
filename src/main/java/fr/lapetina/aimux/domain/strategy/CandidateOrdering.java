package fr.lapetina.aimux.domain.strategy;

import java.util.Comparator;

/**
 * Shared tie-break: higher priority weight first, then provider id ascending.
 */
final class CandidateOrdering {

    static final Comparator<Candidate> BY_PRIORITY_THEN_ID = Comparator
            .comparingInt((Candidate c) -> c.provider().getPriority()).reversed()
            .thenComparing(Candidate::id);

    private CandidateOrdering() {
    }
}
