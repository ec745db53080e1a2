package fr.lapetina.aimux.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Features a provider can serve. A request names the subset it needs.
 */
public enum Capability {
    TEXT("text"),
    VISION("vision"),
    TOOLS("tools"),
    THINKING("thinking"),
    STREAMING("streaming"),
    JSON_MODE("json_mode"),
    FUNCTION_CALLING("function_calling");

    private final String key;

    Capability(String key) {
        this.key = key;
    }

    /**
     * Returns the lowercase name used in configuration files.
     */
    public String getKey() {
        return key;
    }

    /**
     * Parses a configuration name. Case is ignored and '-' is accepted in place of '_'.
     */
    public static Optional<Capability> fromKey(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (Capability capability : values()) {
            if (capability.key.equals(normalized)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }
}
