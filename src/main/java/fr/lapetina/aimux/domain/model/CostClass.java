package fr.lapetina.aimux.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Relative price band of a provider. Lower rank is cheaper.
 */
public enum CostClass {
    LOW,
    MEDIUM,
    HIGH;

    public int rank() {
        return ordinal();
    }

    public static Optional<CostClass> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
