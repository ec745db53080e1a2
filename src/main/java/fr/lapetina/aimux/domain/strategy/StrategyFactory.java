package fr.lapetina.aimux.domain.strategy;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Creates selection strategies by configuration name.
 *
 * Supports runtime strategy switching without restart.
 */
public final class StrategyFactory {

    public static final String DEFAULT_STRATEGY = "capability";

    private static final Map<String, Supplier<LoadBalancingStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("capability", CapabilityStrategy::new);
        register("cost", CostStrategy::new);
        register("performance", PerformanceStrategy::new);
        register("round-robin", RoundRobinStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<LoadBalancingStrategy> supplier) {
        REGISTRY.put(normalize(name), supplier);
    }

    /**
     * Creates a strategy by name. Case is ignored and '_' is accepted in place of '-'.
     *
     * @return Strategy instance, or empty if not found
     */
    public static Optional<LoadBalancingStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<LoadBalancingStrategy> supplier = REGISTRY.get(normalize(name));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    public static LoadBalancingStrategy createOrDefault(String name, LoadBalancingStrategy defaultStrategy) {
        return create(name).orElse(defaultStrategy);
    }

    public static boolean isRegistered(String name) {
        return name != null && REGISTRY.containsKey(normalize(name));
    }

    /**
     * Returns all registered strategy names, sorted.
     */
    public static Set<String> getRegisteredNames() {
        return new TreeSet<>(REGISTRY.keySet());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase().replace('_', '-');
    }
}
