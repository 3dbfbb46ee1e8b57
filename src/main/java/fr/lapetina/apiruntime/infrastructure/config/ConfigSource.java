package fr.lapetina.apiruntime.infrastructure.config;

/**
 * Produces a freshly parsed configuration value.
 */
@FunctionalInterface
public interface ConfigSource {

    /**
     * Loads the configuration.
     *
     * @return the loaded configuration
     * @throws ConfigurationException if the source cannot be read or parsed
     */
    ApiServerConfig load();
}
