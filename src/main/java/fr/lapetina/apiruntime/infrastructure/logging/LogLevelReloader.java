package fr.lapetina.apiruntime.infrastructure.logging;

/**
 * Applies a new {@code logging.level} value to the running logging backend.
 */
@FunctionalInterface
public interface LogLevelReloader {

    /**
     * @param level level or directives, see {@link LogLevelDirectives}
     * @throws IllegalArgumentException if the value cannot be applied
     */
    void reload(String level);
}
