package fr.lapetina.apiruntime.infrastructure.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogbackLevelReloaderTest {

    private LoggerContext context;
    private LogbackLevelReloader reloader;

    @BeforeEach
    void setUp() {
        // Private context so the test does not disturb the shared logging setup
        context = new LoggerContext();
        reloader = new LogbackLevelReloader(context);
    }

    @Test
    @DisplayName("should set the root level")
    void shouldSetRootLevel() {
        reloader.reload("error");

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @DisplayName("should set and later clear per-logger levels")
    void shouldClearRemovedLoggers() {
        reloader.reload("info,com.example.a=debug,com.example.b=warn");

        assertThat(context.getLogger("com.example.a").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("com.example.b").getLevel()).isEqualTo(Level.WARN);

        reloader.reload("info,com.example.b=error");

        assertThat(context.getLogger("com.example.a").getLevel()).isNull();
        assertThat(context.getLogger("com.example.a").getEffectiveLevel()).isEqualTo(Level.INFO);
        assertThat(context.getLogger("com.example.b").getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @DisplayName("should leave levels untouched on invalid input")
    void shouldRejectInvalidInput() {
        reloader.reload("warn");

        assertThatThrownBy(() -> reloader.reload("chatty"))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    @DisplayName("should bind to the active Logback context by default")
    void shouldBindToActiveContext() {
        LogbackLevelReloader active = new LogbackLevelReloader();

        assertThat(active).isNotNull();
    }
}
