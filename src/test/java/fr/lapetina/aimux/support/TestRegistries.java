package fr.lapetina.aimux.support;

import fr.lapetina.aimux.domain.bridge.BridgeCatalog;
import fr.lapetina.aimux.domain.event.RoutingEventSink;
import fr.lapetina.aimux.infrastructure.config.RouterConfig;
import fr.lapetina.aimux.infrastructure.health.HealthMonitor;
import fr.lapetina.aimux.infrastructure.registry.ProviderRegistry;

import java.time.Clock;
import java.util.Map;

/**
 * Wires a registry and its health monitor the way the router factory does.
 */
public final class TestRegistries {

    private TestRegistries() {
    }

    public static ProviderRegistry loaded(RouterConfig config, BridgeCatalog catalog,
                                          RoutingEventSink events, Clock clock) {
        return loaded(config, catalog, events, clock, Map.of());
    }

    public static ProviderRegistry loaded(RouterConfig config, BridgeCatalog catalog,
                                          RoutingEventSink events, Clock clock, Map<String, String> env) {
        HealthMonitor monitor = new HealthMonitor(config.getHealthCheck().toPolicy(), events, clock);
        ProviderRegistry registry = new ProviderRegistry(catalog, monitor, events, clock, env::get);
        registry.reload(config);
        return registry;
    }
}
