package fr.lapetina.aimux.infrastructure.config;

/**
 * Listener for configuration changes.
 *
 * A listener may veto a change by throwing {@link ConfigLoader.ConfigurationException};
 * the loader then keeps the previous configuration.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called when configuration changes.
     *
     * @param oldConfig Previous configuration (may be null on first load)
     * @param newConfig New configuration
     */
    void onConfigChanged(RouterConfig oldConfig, RouterConfig newConfig);
}
