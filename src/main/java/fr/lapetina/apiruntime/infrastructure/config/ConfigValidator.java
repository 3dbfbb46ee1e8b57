package fr.lapetina.apiruntime.infrastructure.config;

/**
 * Semantic checks applied to a loaded configuration before it is used.
 */
@FunctionalInterface
public interface ConfigValidator {

    /**
     * @throws ConfigurationException describing the first violated constraint
     */
    void validate(ApiServerConfig config);
}
