package fr.lapetina.apiruntime.infrastructure.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * {@link LogLevelReloader} backed by Logback.
 *
 * Loggers configured by a previous call but absent from the new directives
 * go back to inheriting their level.
 */
public final class LogbackLevelReloader implements LogLevelReloader {

    private static final Logger log = LoggerFactory.getLogger(LogbackLevelReloader.class);

    private final LoggerContext context;
    private final Set<String> configuredLoggers = new HashSet<>();

    public LogbackLevelReloader() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext loggerContext)) {
            throw new IllegalStateException("Logback is not the active SLF4J backend: " + factory.getClass().getName());
        }
        this.context = loggerContext;
    }

    LogbackLevelReloader(LoggerContext context) {
        this.context = context;
    }

    @Override
    public synchronized void reload(String level) {
        LogLevelDirectives directives = LogLevelDirectives.parse(level);

        for (String name : configuredLoggers) {
            if (!directives.loggerLevels().containsKey(name)) {
                context.getLogger(name).setLevel(null);
            }
        }
        configuredLoggers.clear();

        directives.rootLevelValue().ifPresent(root ->
                context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(root)));

        for (Map.Entry<String, String> entry : directives.loggerLevels().entrySet()) {
            context.getLogger(entry.getKey()).setLevel(Level.toLevel(entry.getValue()));
            configuredLoggers.add(entry.getKey());
        }

        log.info("Log level updated at runtime: level={}", level);
    }
}
