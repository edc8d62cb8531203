package com.letably.reporting.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the report service, bound from {@code letably.reporting.*}:
 *
 * <pre>
 * letably:
 *   reporting:
 *     max-attempts: 3
 *     time-zone: Europe/London
 * </pre>
 *
 * @param maxAttempts attempts per report when the pool is exhausted, first try included (default 3)
 * @param timeZone    zone used to decide "today" for date windows and arrears (default Europe/London)
 */
@ConfigurationProperties(prefix = "letably.reporting")
@Validated
public record ReportingProperties(@Positive Integer maxAttempts, @NotBlank String timeZone) {

    /**
     * Compact constructor applying defaults. Runs before Bean Validation.
     */
    public ReportingProperties {
        if (maxAttempts == null) {
            maxAttempts = 3;
        }
        if (timeZone == null || timeZone.isBlank()) {
            timeZone = "Europe/London";
        }
    }
}
