package fr.lapetina.aimux.infrastructure.config;

import fr.lapetina.aimux.infrastructure.health.HealthPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the router.
 * Designed to be populated from YAML.
 */
public class RouterConfig {

    private ServerConfig server = new ServerConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private StrategyConfig strategy = new StrategyConfig();
    private FailoverConfig failover = new FailoverConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private PerformanceConfig performance = new PerformanceConfig();
    private EventsConfig events = new EventsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public StrategyConfig getStrategy() { return strategy; }
    public void setStrategy(StrategyConfig strategy) { this.strategy = strategy; }

    public FailoverConfig getFailover() { return failover; }
    public void setFailover(FailoverConfig failover) { this.failover = failover; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public PerformanceConfig getPerformance() { return performance; }
    public void setPerformance(PerformanceConfig performance) { this.performance = performance; }

    public EventsConfig getEvents() { return events; }
    public void setEvents(EventsConfig events) { this.events = events; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Optional status/admin HTTP server.
     */
    public static class ServerConfig {
        private boolean enabled = false;
        private String host = "0.0.0.0";
        private int port = 8080;
        private int backlog = 100;
        private int threads = 4;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * One upstream AI provider.
     * Capabilities, cost class and speed class fall back to the bridge's description when absent.
     */
    public static class ProviderConfig {
        private String id;
        private String displayName;
        private String bridge;
        private List<String> capabilities;
        private String costClass;
        private String speedClass;
        private int priority = 0;
        private int requestsPerWindow = 60;
        private long rateWindowMs = 60_000;
        private boolean enabled = true;
        private List<CredentialConfig> credentials = new ArrayList<>();
        private Map<String, Object> settings = new LinkedHashMap<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public String getBridge() { return bridge; }
        public void setBridge(String bridge) { this.bridge = bridge; }

        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }

        public String getCostClass() { return costClass; }
        public void setCostClass(String costClass) { this.costClass = costClass; }

        public String getSpeedClass() { return speedClass; }
        public void setSpeedClass(String speedClass) { this.speedClass = speedClass; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public int getRequestsPerWindow() { return requestsPerWindow; }
        public void setRequestsPerWindow(int requestsPerWindow) { this.requestsPerWindow = requestsPerWindow; }

        public long getRateWindowMs() { return rateWindowMs; }
        public void setRateWindowMs(long rateWindowMs) { this.rateWindowMs = rateWindowMs; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public List<CredentialConfig> getCredentials() { return credentials; }
        public void setCredentials(List<CredentialConfig> credentials) { this.credentials = credentials; }

        public Map<String, Object> getSettings() { return settings; }
        public void setSettings(Map<String, Object> settings) { this.settings = settings; }
    }

    /**
     * One API key. Either {@code secret} or {@code secretEnv} (an environment variable name) is set.
     */
    public static class CredentialConfig {
        private String id;
        private String secret;
        private String secretEnv;

        public CredentialConfig() {
        }

        public CredentialConfig(String id, String secret) {
            this.id = id;
            this.secret = secret;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }

        public String getSecretEnv() { return secretEnv; }
        public void setSecretEnv(String secretEnv) { this.secretEnv = secretEnv; }
    }

    /**
     * Provider selection strategy.
     */
    public static class StrategyConfig {
        private String type = "capability";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    /**
     * Retry budget and timeouts of a routing decision.
     */
    public static class FailoverConfig {
        private int maxAttempts = 0;
        private int maxAttemptsCap = 5;
        private long attemptTimeoutMs = 30_000;
        private long requestDeadlineMs = 0;

        /** 0 means one attempt per eligible provider. */
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public int getMaxAttemptsCap() { return maxAttemptsCap; }
        public void setMaxAttemptsCap(int maxAttemptsCap) { this.maxAttemptsCap = maxAttemptsCap; }

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

        /** 0 means no default deadline. */
        public long getRequestDeadlineMs() { return requestDeadlineMs; }
        public void setRequestDeadlineMs(long requestDeadlineMs) { this.requestDeadlineMs = requestDeadlineMs; }
    }

    /**
     * Circuit breaker thresholds and active probing.
     */
    public static class HealthCheckConfig {
        private int failureThreshold = 5;
        private int successThreshold = 3;
        private long cooldownMs = 30_000;
        private long maxCooldownMs = 300_000;
        private long probeIntervalMs = 0;
        private long probeTimeoutMs = 5_000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }

        public long getMaxCooldownMs() { return maxCooldownMs; }
        public void setMaxCooldownMs(long maxCooldownMs) { this.maxCooldownMs = maxCooldownMs; }

        /** 0 disables active probing. */
        public long getProbeIntervalMs() { return probeIntervalMs; }
        public void setProbeIntervalMs(long probeIntervalMs) { this.probeIntervalMs = probeIntervalMs; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

        public HealthPolicy toPolicy() {
            return new HealthPolicy(
                    failureThreshold,
                    successThreshold,
                    Duration.ofMillis(cooldownMs),
                    Duration.ofMillis(maxCooldownMs)
            );
        }
    }

    /**
     * Rolling latency window.
     */
    public static class PerformanceConfig {
        private int windowSize = 50;

        public int getWindowSize() { return windowSize; }
        public void setWindowSize(int windowSize) { this.windowSize = windowSize; }
    }

    /**
     * LMAX Disruptor event bus.
     */
    public static class EventsConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "aimux";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
