package fr.lapetina.aimux.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Advertised responsiveness band of a provider. Lower rank is faster.
 */
public enum SpeedClass {
    FAST,
    MEDIUM,
    SLOW;

    public int rank() {
        return ordinal();
    }

    public static Optional<SpeedClass> fromName(String name) {
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
