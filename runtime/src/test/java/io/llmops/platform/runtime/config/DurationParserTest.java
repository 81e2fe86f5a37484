package io.llmops.platform.runtime.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurationParserTest {

    @Test
    void parsesUnits() {
        assertThat(DurationParser.parse("250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(DurationParser.parse("5s")).isEqualTo(Duration.ofSeconds(5));
        assertThat(DurationParser.parse("5m")).isEqualTo(Duration.ofMinutes(5));
        assertThat(DurationParser.parse("1h")).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void parsesFractionsAndBareSeconds() {
        assertThat(DurationParser.parse("0.5s")).isEqualTo(Duration.ofMillis(500));
        assertThat(DurationParser.parse(" 30 ")).isEqualTo(Duration.ofSeconds(30));
        assertThat(DurationParser.parse("2S")).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> DurationParser.parse("soon"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("soon");
        assertThatThrownBy(() -> DurationParser.parse("-5s"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void detectsExplicitUnit() {
        assertThat(DurationParser.hasUnit("0.5s")).isTrue();
        assertThat(DurationParser.hasUnit("100")).isFalse();
        assertThat(DurationParser.hasUnit("5%")).isFalse();
        assertThat(DurationParser.hasUnit(null)).isFalse();
    }

    @Test
    void fieldErrorsNameTheField() {
        assertThatThrownBy(() -> DurationParser.parseField("shutdown_timeout", "later", Duration.ZERO))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("shutdown_timeout:");
    }

    @Test
    void blankFieldFallsBack() throws ConfigException {
        assertThat(DurationParser.parseField("startup_timeout", null, Duration.ofSeconds(30)))
                .isEqualTo(Duration.ofSeconds(30));
        assertThat(DurationParser.parseField("startup_timeout", " ", Duration.ofSeconds(30)))
                .isEqualTo(Duration.ofSeconds(30));
    }
}
