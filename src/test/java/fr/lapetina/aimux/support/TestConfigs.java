package fr.lapetina.aimux.support;

import fr.lapetina.aimux.infrastructure.config.RouterConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds in-memory configurations for tests.
 */
public final class TestConfigs {

    private TestConfigs() {
    }

    public static RouterConfig config(RouterConfig.ProviderConfig... providers) {
        RouterConfig config = new RouterConfig();
        config.setProviders(new ArrayList<>(List.of(providers)));
        config.getHealthCheck().setFailureThreshold(3);
        config.getHealthCheck().setSuccessThreshold(2);
        config.getHealthCheck().setCooldownMs(1_000);
        config.getHealthCheck().setMaxCooldownMs(8_000);
        config.getFailover().setAttemptTimeoutMs(2_000);
        config.getEvents().setRingBufferSize(256);
        return config;
    }

    public static ProviderBuilder provider(String id) {
        return new ProviderBuilder(id);
    }

    public static final class ProviderBuilder {
        private final RouterConfig.ProviderConfig config = new RouterConfig.ProviderConfig();

        private ProviderBuilder(String id) {
            config.setId(id);
            config.setBridge(id);
            config.setCapabilities(new ArrayList<>(List.of("text")));
            config.setCostClass("medium");
            config.setSpeedClass("medium");
            config.setCredentials(new ArrayList<>());
        }

        public ProviderBuilder bridge(String bridge) {
            config.setBridge(bridge);
            return this;
        }

        public ProviderBuilder capabilities(String... capabilities) {
            config.setCapabilities(new ArrayList<>(List.of(capabilities)));
            return this;
        }

        public ProviderBuilder fromBridgeDescription() {
            config.setCapabilities(null);
            config.setCostClass(null);
            config.setSpeedClass(null);
            return this;
        }

        public ProviderBuilder cost(String costClass) {
            config.setCostClass(costClass);
            return this;
        }

        public ProviderBuilder speed(String speedClass) {
            config.setSpeedClass(speedClass);
            return this;
        }

        public ProviderBuilder priority(int priority) {
            config.setPriority(priority);
            return this;
        }

        public ProviderBuilder quota(int requestsPerWindow) {
            config.setRequestsPerWindow(requestsPerWindow);
            return this;
        }

        public ProviderBuilder windowMs(long rateWindowMs) {
            config.setRateWindowMs(rateWindowMs);
            return this;
        }

        public ProviderBuilder disabled() {
            config.setEnabled(false);
            return this;
        }

        public ProviderBuilder credential(String id) {
            return credential(id, "secret-" + config.getId() + "-" + id);
        }

        public ProviderBuilder credential(String id, String secret) {
            config.getCredentials().add(new RouterConfig.CredentialConfig(id, secret));
            return this;
        }

        public ProviderBuilder credentialFromEnv(String id, String variable) {
            RouterConfig.CredentialConfig credential = new RouterConfig.CredentialConfig();
            credential.setId(id);
            credential.setSecretEnv(variable);
            config.getCredentials().add(credential);
            return this;
        }

        public RouterConfig.ProviderConfig build() {
            return config;
        }
    }
}
