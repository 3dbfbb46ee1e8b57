package fr.lapetina.apiruntime.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called after a changed configuration has been applied.
     *
     * @param oldConfig The previously applied configuration
     * @param newConfig The new configuration
     */
    void onConfigChanged(ApiServerConfig oldConfig, ApiServerConfig newConfig);
}
