package fr.lapetina.apiruntime.infrastructure.config;

/**
 * Exception for configuration errors: an unreadable or unparsable source, a value
 * that fails validation, or key material that cannot be resolved.
 * Callers tell them apart by message only.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
