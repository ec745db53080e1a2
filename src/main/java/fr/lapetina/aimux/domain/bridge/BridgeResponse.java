package fr.lapetina.aimux.domain.bridge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider answer. The body is opaque to the router.
 */
public record BridgeResponse(Object body, Map<String, Object> metadata) {

    public BridgeResponse {
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public static BridgeResponse of(Object body) {
        return new BridgeResponse(body, Map.of());
    }
}
