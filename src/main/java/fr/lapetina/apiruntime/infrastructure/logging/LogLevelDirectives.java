package fr.lapetina.apiruntime.infrastructure.logging;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed form of a {@code logging.level} setting.
 *
 * Accepts a bare level ({@code info}) or comma-separated directives where an
 * entry without {@code =} sets the root level and {@code logger=level} sets a
 * single logger, e.g. {@code warn,fr.lapetina.apiruntime=debug}.
 *
 * @param rootLevel    upper-case root level, null when only logger directives are given
 * @param loggerLevels upper-case level per logger name, in declaration order
 */
public record LogLevelDirectives(String rootLevel, Map<String, String> loggerLevels) {

    private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public LogLevelDirectives {
        loggerLevels = Map.copyOf(loggerLevels);
    }

    public Optional<String> rootLevelValue() {
        return Optional.ofNullable(rootLevel);
    }

    /**
     * @throws IllegalArgumentException if the value is blank or names an unknown level
     */
    public static LogLevelDirectives parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("log level must not be blank");
        }
        String root = null;
        Map<String, String> loggers = new LinkedHashMap<>();
        for (String part : value.split(",")) {
            String directive = part.trim();
            if (directive.isEmpty()) {
                continue;
            }
            int eq = directive.indexOf('=');
            if (eq < 0) {
                root = level(directive, value);
            } else {
                String logger = directive.substring(0, eq).trim();
                if (logger.isEmpty()) {
                    throw new IllegalArgumentException("missing logger name in log directive: " + directive);
                }
                loggers.put(logger, level(directive.substring(eq + 1), value));
            }
        }
        if (root == null && loggers.isEmpty()) {
            throw new IllegalArgumentException("no log level directives in: " + value);
        }
        return new LogLevelDirectives(root, loggers);
    }

    private static String level(String raw, String whole) {
        String level = raw.trim().toUpperCase(Locale.ROOT);
        if (!LEVELS.contains(level)) {
            throw new IllegalArgumentException("unknown log level '" + raw.trim() + "' in: " + whole);
        }
        return level;
    }
}
