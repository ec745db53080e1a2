package fr.lapetina.aimux.infrastructure.registry;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable provider set of one configuration generation, in configuration order.
 * A routing decision pins one snapshot for its whole duration.
 */
public final class RegistrySnapshot {

    private final long generation;
    private final Map<String, ProviderEntry> entries;
    private final Instant loadedAt;

    RegistrySnapshot(long generation, Map<String, ProviderEntry> entries, Instant loadedAt) {
        this.generation = generation;
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.loadedAt = loadedAt;
    }

    static RegistrySnapshot empty(Instant now) {
        return new RegistrySnapshot(0, Map.of(), now);
    }

    public long getGeneration() {
        return generation;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public Optional<ProviderEntry> find(String providerId) {
        return Optional.ofNullable(providerId != null ? entries.get(providerId) : null);
    }

    public Collection<ProviderEntry> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }
}
