package fr.lapetina.aimux;

import fr.lapetina.aimux.api.StatusServer;
import fr.lapetina.aimux.disruptor.EventBus;
import fr.lapetina.aimux.domain.bridge.BridgeCatalog;
import fr.lapetina.aimux.domain.event.RoutingEventListener;
import fr.lapetina.aimux.domain.strategy.LoadBalancer;
import fr.lapetina.aimux.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.aimux.domain.strategy.StrategyFactory;
import fr.lapetina.aimux.infrastructure.config.ConfigLoader;
import fr.lapetina.aimux.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.aimux.infrastructure.config.RouterConfig;
import fr.lapetina.aimux.infrastructure.health.HealthMonitor;
import fr.lapetina.aimux.infrastructure.health.HealthProber;
import fr.lapetina.aimux.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.aimux.infrastructure.registry.ProviderEntry;
import fr.lapetina.aimux.infrastructure.registry.ProviderRegistry;
import fr.lapetina.aimux.router.FailoverPolicy;
import fr.lapetina.aimux.router.FailoverRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Factory for creating a fully-wired router from configuration.
 * This is the primary entry point for embedding the routing core.
 *
 * <p>Usage:
 * <pre>{@code
 * BridgeCatalog bridges = new BridgeCatalog();
 * bridges.register("openai", (providerId, settings) -> new MyOpenAiBridge(settings));
 *
 * try (RouterFactory factory = RouterFactory.create("config.yaml", bridges).start()) {
 *     RouteResponse response = factory.getRouter().route(RouteRequest.of(payload, Capability.TEXT));
 * }
 * }</pre>
 */
public class RouterFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RouterFactory.class);

    private final ConfigLoader configLoader;
    private final BridgeCatalog bridgeCatalog;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;
    private final EventBus eventBus;
    private final HealthMonitor healthMonitor;
    private final ProviderRegistry providerRegistry;
    private final LoadBalancer loadBalancer;
    private final FailoverRouter router;
    private final HealthProber healthProber;
    private volatile RouterConfig config;
    private volatile StatusServer statusServer;

    /**
     * @param configPath    file or classpath resource; ignored when {@code initialConfig} is given
     * @param initialConfig an already loaded configuration, or null to load {@code configPath}
     */
    protected RouterFactory(String configPath, RouterConfig initialConfig, BridgeCatalog bridgeCatalog, Clock clock) {
        this.bridgeCatalog = Objects.requireNonNull(bridgeCatalog, "Bridge catalog is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");

        // Load configuration
        if (initialConfig != null) {
            log.info("Initializing RouterFactory from supplied configuration");
            this.configLoader = null;
            this.config = initialConfig;
        } else {
            log.info("Initializing RouterFactory from config: {}", configPath);
            this.configLoader = new ConfigLoader(configPath);
            this.config = configLoader.load();
        }

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        // Event bus, started with start()
        this.eventBus = EventBus.builder()
                .ringBufferSize(config.getEvents().getRingBufferSize())
                .waitStrategy(config.getEvents().getWaitStrategy())
                .metricsRegistry(metricsRegistry)
                .build();

        // Health and registry
        this.healthMonitor = new HealthMonitor(config.getHealthCheck().toPolicy(), eventBus, clock);
        this.providerRegistry = new ProviderRegistry(bridgeCatalog, healthMonitor, eventBus, clock);
        providerRegistry.reload(config);

        // Create strategy
        LoadBalancingStrategy strategy = StrategyFactory.createOrDefault(
                config.getStrategy().getType(),
                StrategyFactory.create(StrategyFactory.DEFAULT_STRATEGY).orElseThrow()
        );
        log.info("Using load balancing strategy: {}", strategy.getName());
        this.loadBalancer = new LoadBalancer(strategy);

        this.router = new FailoverRouter(
                providerRegistry,
                loadBalancer,
                FailoverRouter.newDispatchExecutor(),
                FailoverPolicy.fromConfig(config.getFailover()),
                eventBus,
                clock
        );

        this.healthProber = new HealthProber(
                providerRegistry,
                Duration.ofMillis(config.getHealthCheck().getProbeIntervalMs()),
                Duration.ofMillis(config.getHealthCheck().getProbeTimeoutMs())
        );

        // Register config change listener
        if (configLoader != null) {
            configLoader.addListener(this::onConfigChanged);
        }

        registerProviderMetrics();

        log.info("RouterFactory initialized with {} providers", providerRegistry.currentSnapshot().size());
    }

    /**
     * Creates a factory from the specified configuration file or classpath resource.
     */
    public static RouterFactory create(String configPath, BridgeCatalog bridgeCatalog) {
        return new RouterFactory(configPath, null, bridgeCatalog, Clock.systemUTC());
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static RouterFactory create(BridgeCatalog bridgeCatalog) {
        return create("config.yaml", bridgeCatalog);
    }

    /**
     * Creates a factory from an in-memory configuration. File watching is not available.
     */
    public static RouterFactory create(RouterConfig config, BridgeCatalog bridgeCatalog) {
        return new RouterFactory(null, Objects.requireNonNull(config, "Config is required"),
                bridgeCatalog, Clock.systemUTC());
    }

    /**
     * Starts the event bus, the health prober, file watching and, when enabled, the status server.
     */
    public RouterFactory start() {
        eventBus.start();
        healthProber.start();
        if (configLoader != null) {
            configLoader.startWatching();
        }

        RouterConfig.ServerConfig server = config.getServer();
        if (server.isEnabled() && statusServer == null) {
            try {
                statusServer = new StatusServer(
                        server.getHost(),
                        server.getPort(),
                        server.getBacklog(),
                        server.getThreads(),
                        providerRegistry,
                        loadBalancer,
                        metricsRegistry,
                        this::reloadConfiguration
                );
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to start status server on port " + server.getPort(), e);
            }
            statusServer.start();
        }

        log.info("Router started");
        return this;
    }

    public FailoverRouter getRouter() {
        return router;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public LoadBalancer getLoadBalancer() {
        return loadBalancer;
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public HealthProber getHealthProber() {
        return healthProber;
    }

    /**
     * Returns the metrics registry, or null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public BridgeCatalog getBridgeCatalog() {
        return bridgeCatalog;
    }

    /**
     * Returns the status server, or null when it is disabled or not started yet.
     */
    public StatusServer getStatusServer() {
        return statusServer;
    }

    public RouterConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public void addEventListener(RoutingEventListener listener) {
        eventBus.addListener(listener);
    }

    public void removeEventListener(RoutingEventListener listener) {
        eventBus.removeListener(listener);
    }

    /**
     * Re-reads the configuration source and applies it.
     *
     * @throws ConfigurationException if the new configuration is rejected; the current one stays in effect
     */
    public void reloadConfiguration() {
        if (configLoader != null) {
            configLoader.load();
        } else {
            applyConfiguration(config);
        }
    }

    /**
     * Applies a new configuration: providers, strategy and failover policy.
     *
     * @throws ConfigurationException if the configuration is invalid; nothing is changed
     */
    public synchronized void applyConfiguration(RouterConfig newConfig) {
        log.info("Configuration changed, applying updates...");
        RouterConfig oldConfig = this.config;

        providerRegistry.reload(newConfig);

        // Update strategy if changed
        String newType = newConfig.getStrategy().getType();
        if (oldConfig == null || !Objects.equals(oldConfig.getStrategy().getType(), newType)) {
            loadBalancer.setStrategy(StrategyFactory.createOrDefault(newType, loadBalancer.getStrategy()));
        }

        router.setPolicy(FailoverPolicy.fromConfig(newConfig.getFailover()));
        registerProviderMetrics();

        this.config = newConfig;
        log.info("Configuration updates applied: generation={}", providerRegistry.getGeneration());
    }

    private void onConfigChanged(RouterConfig oldConfig, RouterConfig newConfig) {
        applyConfiguration(newConfig);
    }

    private void registerProviderMetrics() {
        if (metricsRegistry == null) {
            return;
        }
        for (ProviderEntry entry : providerRegistry.currentSnapshot().entries()) {
            String providerId = entry.getId();
            metricsRegistry.registerProviderGauges(
                    providerId,
                    () -> providerRegistry.find(providerId)
                            .map(e -> e.getCircuitBreaker().getState().gaugeValue())
                            .orElse(-1),
                    () -> providerRegistry.find(providerId)
                            .map(e -> e.availableCredentials(clock.instant()))
                            .orElse(0)
            );
        }
    }

    @Override
    public void close() {
        log.info("Shutting down RouterFactory...");

        if (statusServer != null) {
            try {
                statusServer.close();
            } catch (Exception e) {
                log.warn("Error closing status server", e);
            }
        }

        try {
            healthProber.close();
        } catch (Exception e) {
            log.warn("Error closing health prober", e);
        }

        try {
            router.close();
        } catch (Exception e) {
            log.warn("Error closing router", e);
        }

        try {
            eventBus.close();
        } catch (Exception e) {
            log.warn("Error closing event bus", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        if (configLoader != null) {
            try {
                configLoader.close();
            } catch (Exception e) {
                log.warn("Error closing config loader", e);
            }
        }

        log.info("RouterFactory shut down");
    }
}
