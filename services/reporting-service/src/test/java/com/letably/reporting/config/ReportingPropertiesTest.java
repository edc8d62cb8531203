package com.letably.reporting.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ReportingProperties}.
 *
 * <p>WHY: the compact constructor supplies the defaults when keys are missing from the YAML;
 * checked here without starting a Spring context.
 */
@DisplayName("ReportingProperties")
class ReportingPropertiesTest {

    @Test
    @DisplayName("keeps configured values")
    void keepsValues() {
        var props = new ReportingProperties(5, "UTC");

        assertThat(props.maxAttempts()).isEqualTo(5);
        assertThat(props.timeZone()).isEqualTo("UTC");
    }

    @Test
    @DisplayName("defaults to three attempts in London time")
    void defaults() {
        var props = new ReportingProperties(null, null);

        assertThat(props.maxAttempts()).isEqualTo(3);
        assertThat(props.timeZone()).isEqualTo("Europe/London");
    }

    @Test
    @DisplayName("treats a blank time zone as missing")
    void blankZone() {
        assertThat(new ReportingProperties(2, "  ").timeZone()).isEqualTo("Europe/London");
    }

    @Test
    @DisplayName("builds the clock in the configured zone")
    void clockZone() {
        var clock = new ReportingConfig().reportingClock(new ReportingProperties(null, "UTC"));

        assertThat(clock.getZone().getId()).isEqualTo("UTC");
    }
}
