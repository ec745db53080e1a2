package fr.lapetina.aimux.infrastructure.config;

import fr.lapetina.aimux.domain.bridge.BridgeCatalog;
import fr.lapetina.aimux.domain.model.Capability;
import fr.lapetina.aimux.domain.model.CostClass;
import fr.lapetina.aimux.domain.model.SpeedClass;
import fr.lapetina.aimux.domain.strategy.StrategyFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a configuration before it is applied. Reports every problem at once.
 */
public final class ConfigValidator {

    private ConfigValidator() {
        // Utility class
    }

    /**
     * @param bridgeCatalog when not null, bridge types are checked against it
     * @throws ConfigLoader.ConfigurationException listing every problem found
     */
    public static void validate(RouterConfig config, BridgeCatalog bridgeCatalog) {
        List<String> problems = collectProblems(config, bridgeCatalog);
        if (!problems.isEmpty()) {
            throw new ConfigLoader.ConfigurationException(problems);
        }
    }

    public static List<String> collectProblems(RouterConfig config, BridgeCatalog bridgeCatalog) {
        List<String> problems = new ArrayList<>();
        if (config == null) {
            problems.add("configuration is empty");
            return problems;
        }

        validateProviders(config.getProviders(), bridgeCatalog, problems);

        RouterConfig.StrategyConfig strategy = config.getStrategy();
        if (strategy == null || !StrategyFactory.isRegistered(strategy.getType())) {
            problems.add("strategy.type: unknown strategy '" + (strategy != null ? strategy.getType() : null)
                    + "', available " + StrategyFactory.getRegisteredNames());
        }

        RouterConfig.FailoverConfig failover = config.getFailover();
        if (failover == null) {
            problems.add("failover: section is missing");
        } else {
            if (failover.getMaxAttempts() < 0) {
                problems.add("failover.maxAttempts must be >= 0");
            }
            if (failover.getMaxAttemptsCap() < 1) {
                problems.add("failover.maxAttemptsCap must be >= 1");
            }
            if (failover.getAttemptTimeoutMs() <= 0) {
                problems.add("failover.attemptTimeoutMs must be > 0");
            }
            if (failover.getRequestDeadlineMs() < 0) {
                problems.add("failover.requestDeadlineMs must be >= 0");
            }
        }

        RouterConfig.HealthCheckConfig health = config.getHealthCheck();
        if (health == null) {
            problems.add("healthCheck: section is missing");
        } else {
            if (health.getFailureThreshold() < 1) {
                problems.add("healthCheck.failureThreshold must be >= 1");
            }
            if (health.getSuccessThreshold() < 1) {
                problems.add("healthCheck.successThreshold must be >= 1");
            }
            if (health.getCooldownMs() <= 0) {
                problems.add("healthCheck.cooldownMs must be > 0");
            }
            if (health.getMaxCooldownMs() < health.getCooldownMs()) {
                problems.add("healthCheck.maxCooldownMs must be >= cooldownMs");
            }
            if (health.getProbeIntervalMs() < 0) {
                problems.add("healthCheck.probeIntervalMs must be >= 0");
            }
            if (health.getProbeTimeoutMs() <= 0) {
                problems.add("healthCheck.probeTimeoutMs must be > 0");
            }
        }

        if (config.getPerformance() == null || config.getPerformance().getWindowSize() < 1) {
            problems.add("performance.windowSize must be >= 1");
        }

        RouterConfig.EventsConfig events = config.getEvents();
        if (events == null || events.getRingBufferSize() < 1 || Integer.bitCount(events.getRingBufferSize()) != 1) {
            problems.add("events.ringBufferSize must be a power of 2");
        }

        RouterConfig.ServerConfig server = config.getServer();
        if (server != null && server.isEnabled()) {
            if (server.getPort() < 0 || server.getPort() > 65535) {
                problems.add("server.port must be between 0 and 65535");
            }
            if (server.getThreads() < 1) {
                problems.add("server.threads must be >= 1");
            }
        }

        return problems;
    }

    private static void validateProviders(
            List<RouterConfig.ProviderConfig> providers,
            BridgeCatalog bridgeCatalog,
            List<String> problems
    ) {
        if (providers == null) {
            problems.add("providers: section is missing");
            return;
        }

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < providers.size(); i++) {
            RouterConfig.ProviderConfig provider = providers.get(i);
            if (provider == null) {
                problems.add("providers[" + i + "] is empty");
                continue;
            }
            String id = provider.getId();
            String where = "providers[" + (id != null && !id.isBlank() ? id : String.valueOf(i)) + "]";

            if (id == null || id.isBlank()) {
                problems.add(where + ".id is required");
            } else if (!ids.add(id)) {
                problems.add(where + ".id is duplicated");
            }

            if (provider.getBridge() == null || provider.getBridge().isBlank()) {
                problems.add(where + ".bridge is required");
            } else if (bridgeCatalog != null && !bridgeCatalog.contains(provider.getBridge())) {
                problems.add(where + ".bridge: unknown type '" + provider.getBridge()
                        + "', available " + bridgeCatalog.getRegisteredTypes());
            }

            if (provider.getCapabilities() != null) {
                for (String capability : provider.getCapabilities()) {
                    if (Capability.fromKey(capability).isEmpty()) {
                        problems.add(where + ".capabilities: unknown capability '" + capability + "'");
                    }
                }
            }
            if (provider.getCostClass() != null && CostClass.fromName(provider.getCostClass()).isEmpty()) {
                problems.add(where + ".costClass: unknown value '" + provider.getCostClass() + "'");
            }
            if (provider.getSpeedClass() != null && SpeedClass.fromName(provider.getSpeedClass()).isEmpty()) {
                problems.add(where + ".speedClass: unknown value '" + provider.getSpeedClass() + "'");
            }
            if (provider.getRequestsPerWindow() < 1) {
                problems.add(where + ".requestsPerWindow must be >= 1");
            }
            if (provider.getRateWindowMs() < 1) {
                problems.add(where + ".rateWindowMs must be >= 1");
            }

            validateCredentials(where, provider.getCredentials(), problems);
        }
    }

    private static void validateCredentials(
            String where,
            List<RouterConfig.CredentialConfig> credentials,
            List<String> problems
    ) {
        if (credentials == null) {
            return;
        }
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < credentials.size(); i++) {
            RouterConfig.CredentialConfig credential = credentials.get(i);
            if (credential == null) {
                problems.add(where + ".credentials[" + i + "] is empty");
                continue;
            }
            String credentialWhere = where + ".credentials[" + i + "]";
            if (credential.getId() == null || credential.getId().isBlank()) {
                problems.add(credentialWhere + ".id is required");
            } else if (!ids.add(credential.getId())) {
                problems.add(credentialWhere + ".id '" + credential.getId() + "' is duplicated");
            }
            boolean hasSecret = credential.getSecret() != null && !credential.getSecret().isBlank();
            boolean hasEnv = credential.getSecretEnv() != null && !credential.getSecretEnv().isBlank();
            if (!hasSecret && !hasEnv) {
                problems.add(credentialWhere + " needs secret or secretEnv");
            }
        }
    }
}
