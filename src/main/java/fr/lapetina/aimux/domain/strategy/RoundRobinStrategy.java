package fr.lapetina.aimux.domain.strategy;

import fr.lapetina.aimux.domain.model.Provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Round-robin over the candidate set.
 *
 * One cursor is kept per distinct candidate set, keyed by the sorted provider ids,
 * so a failover-reduced set does not disturb the rotation of the full set.
 * The cursor is advanced with getAndIncrement on every call, whatever the outcome,
 * and two concurrent selections never observe the same cursor value.
 * Past {@value #MAX_TRACKED_SETS} sets, the least recently used cursor is evicted.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private static final int MAX_TRACKED_SETS = 4096;

    private final Map<String, AtomicLong> cursors;

    public RoundRobinStrategy() {
        this(MAX_TRACKED_SETS);
    }

    RoundRobinStrategy(int maxTrackedSets) {
        if (maxTrackedSets < 1) {
            throw new IllegalArgumentException("maxTrackedSets must be >= 1: " + maxTrackedSets);
        }
        this.cursors = Collections.synchronizedMap(new LinkedHashMap<String, AtomicLong>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, AtomicLong> eldest) {
                return size() > maxTrackedSets;
            }
        });
    }

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public Optional<Provider> select(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparing(Candidate::id));

        AtomicLong cursor = cursorFor(sorted);
        long ticket = cursor.getAndIncrement();
        int index = (int) Math.floorMod(ticket, (long) sorted.size());

        return Optional.of(sorted.get(index).provider());
    }

    private AtomicLong cursorFor(List<Candidate> sorted) {
        StringBuilder key = new StringBuilder();
        for (Candidate candidate : sorted) {
            key.append(candidate.id()).append('\u0000');
        }
        return cursors.computeIfAbsent(key.toString(), k -> new AtomicLong());
    }

    @Override
    public void reset() {
        cursors.clear();
    }
}
