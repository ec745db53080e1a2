package fr.lapetina.aimux.domain.bridge;

import java.util.Map;

/**
 * Creates a bridge for one configured provider.
 */
@FunctionalInterface
public interface BridgeFactory {

    /**
     * @param providerId configured provider id
     * @param settings   free-form bridge settings from the provider's configuration, never null
     */
    Bridge create(String providerId, Map<String, Object> settings);
}
