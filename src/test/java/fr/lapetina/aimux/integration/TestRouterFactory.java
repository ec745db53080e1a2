package fr.lapetina.aimux.integration;

import fr.lapetina.aimux.RouterFactory;
import fr.lapetina.aimux.domain.bridge.BridgeCatalog;
import fr.lapetina.aimux.infrastructure.config.RouterConfig;
import fr.lapetina.aimux.support.ScriptedBridge;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test extension of RouterFactory whose "scripted" bridge type hands out one
 * {@link ScriptedBridge} per provider id.
 */
public final class TestRouterFactory extends RouterFactory {

    public static final String BRIDGE_TYPE = "scripted";

    private final Map<String, ScriptedBridge> bridges;

    private TestRouterFactory(String configPath, RouterConfig config, Map<String, ScriptedBridge> bridges) {
        super(configPath, config, scriptedCatalog(bridges), Clock.systemUTC());
        this.bridges = bridges;
    }

    /**
     * Creates and starts a factory from the default test configuration.
     */
    public static TestRouterFactory create() {
        return create("test-config.yaml");
    }

    /**
     * Creates and starts a factory from a file or classpath resource.
     */
    public static TestRouterFactory create(String configPath) {
        TestRouterFactory factory = new TestRouterFactory(configPath, null, new ConcurrentHashMap<>());
        factory.start();
        return factory;
    }

    /**
     * Creates and starts a factory from an in-memory configuration.
     */
    public static TestRouterFactory create(RouterConfig config) {
        TestRouterFactory factory = new TestRouterFactory(null, config, new ConcurrentHashMap<>());
        factory.start();
        return factory;
    }

    /**
     * Returns the bridge of a provider; the same instance survives configuration reloads.
     */
    public ScriptedBridge bridge(String providerId) {
        return bridges.computeIfAbsent(providerId, ScriptedBridge::new);
    }

    private static BridgeCatalog scriptedCatalog(Map<String, ScriptedBridge> bridges) {
        return new BridgeCatalog().register(BRIDGE_TYPE,
                (providerId, settings) -> bridges.computeIfAbsent(providerId, ScriptedBridge::new));
    }
}
