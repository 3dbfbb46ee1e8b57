package fr.lapetina.apiruntime.infrastructure.logging;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogLevelDirectivesTest {

    @Test
    @DisplayName("should parse a bare level")
    void shouldParseBareLevel() {
        LogLevelDirectives directives = LogLevelDirectives.parse("info");

        assertThat(directives.rootLevelValue()).contains("INFO");
        assertThat(directives.loggerLevels()).isEmpty();
    }

    @Test
    @DisplayName("should parse root and per-logger directives")
    void shouldParseDirectives() {
        LogLevelDirectives directives = LogLevelDirectives.parse("warn, fr.lapetina.apiruntime=Debug,audit=off");

        assertThat(directives.rootLevel()).isEqualTo("WARN");
        assertThat(directives.loggerLevels())
                .containsEntry("fr.lapetina.apiruntime", "DEBUG")
                .containsEntry("audit", "OFF");
    }

    @Test
    @DisplayName("should allow logger directives without a root level")
    void shouldAllowLoggerOnly() {
        LogLevelDirectives directives = LogLevelDirectives.parse("com.example=trace");

        assertThat(directives.rootLevelValue()).isEmpty();
        assertThat(directives.loggerLevels()).containsEntry("com.example", "TRACE");
    }

    @Test
    @DisplayName("should reject unknown levels and empty input")
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> LogLevelDirectives.parse("verbose"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("verbose");
        assertThatThrownBy(() -> LogLevelDirectives.parse(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LogLevelDirectives.parse(" , "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LogLevelDirectives.parse("=debug"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
