package com.gillianbc.networth.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Boundary defaults for forecasts.
 *
 * @param defaultMonths  horizon used when a request gives none
 * @param maxMonths      requests asking for more months are clamped to this
 * @param defaultVariant model used when a request names none
 * @param seed           fixed seed for every request; null for a fresh seed per request
 */
@Validated
@ConfigurationProperties(prefix = "projection")
public record ProjectionProperties(
        @Min(1) int defaultMonths,
        @Min(1) @Max(1200) int maxMonths,
        @NotBlank String defaultVariant,
        Long seed
) {
    public static ProjectionProperties defaults() {
        return new ProjectionProperties(12, 120, "realistic", null);
    }
}
