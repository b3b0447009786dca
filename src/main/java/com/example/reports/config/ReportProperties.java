package com.example.reports.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Report settings bound from {@code reports.*}.
 *
 * @param maxRows          largest row count accepted in one request
 * @param includeTimestamp whether PDF headers carry a "Generated:" line
 * @param headerColor      table header background as a hex color, e.g. {@code #3B82F6}
 */
@ConfigurationProperties(prefix = "reports")
public record ReportProperties(
        @DefaultValue("10000") int maxRows,
        @DefaultValue("true") boolean includeTimestamp,
        @DefaultValue("#3B82F6") String headerColor
) {

    public ReportProperties {
        if (maxRows < 1) {
            throw new IllegalArgumentException("reports.max-rows must be positive");
        }
    }
}
