package fr.lapetina.aimux.domain.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps bridge type names used in configuration to factories supplied by the embedding application.
 */
public final class BridgeCatalog {

    private static final Logger log = LoggerFactory.getLogger(BridgeCatalog.class);

    private final Map<String, BridgeFactory> factories = new ConcurrentHashMap<>();

    /**
     * Registers a factory under a type name, replacing any previous one.
     */
    public BridgeCatalog register(String type, BridgeFactory factory) {
        Objects.requireNonNull(type, "Bridge type is required");
        Objects.requireNonNull(factory, "Bridge factory is required");
        BridgeFactory previous = factories.put(normalize(type), factory);
        if (previous != null) {
            log.info("Bridge factory replaced: type={}", type);
        } else {
            log.debug("Bridge factory registered: type={}", type);
        }
        return this;
    }

    /**
     * Registers a single shared bridge instance under a type name.
     */
    public BridgeCatalog register(String type, Bridge bridge) {
        Objects.requireNonNull(bridge, "Bridge is required");
        return register(type, (providerId, settings) -> bridge);
    }

    public boolean contains(String type) {
        return type != null && factories.containsKey(normalize(type));
    }

    /**
     * Creates a bridge for a provider.
     *
     * @throws IllegalArgumentException if the type is unknown or the factory returns null
     */
    public Bridge create(String type, String providerId, Map<String, Object> settings) {
        BridgeFactory factory = type != null ? factories.get(normalize(type)) : null;
        if (factory == null) {
            throw new IllegalArgumentException("Unknown bridge type: " + type + ". Available: " + getRegisteredTypes());
        }
        Bridge bridge = factory.create(providerId, settings != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(settings))
                : Map.of());
        if (bridge == null) {
            throw new IllegalArgumentException("Bridge factory returned null: type=" + type + ", providerId=" + providerId);
        }
        return bridge;
    }

    public Set<String> getRegisteredTypes() {
        return new TreeSet<>(factories.keySet());
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase();
    }
}
