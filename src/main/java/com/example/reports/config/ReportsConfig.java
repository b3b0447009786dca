package com.example.reports.config;

import java.awt.Color;
import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.reports.export.ReportStyle;
import com.example.reports.service.RenderSettings;

/**
 * Wires the clock and rendering settings used by the report compiler.
 */
@Configuration
@EnableConfigurationProperties(ReportProperties.class)
public class ReportsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RenderSettings renderSettings(ReportProperties properties, Clock clock) {
        ReportStyle style = ReportStyle.defaults();
        if (properties.headerColor() != null && !properties.headerColor().isBlank()) {
            style = style.withHeaderBackground(parseColor(properties.headerColor().trim()));
        }
        return new RenderSettings(style, clock, properties.includeTimestamp());
    }

    static Color parseColor(String hex) {
        try {
            return Color.decode(hex);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("reports.header-color is not a hex color: " + hex, e);
        }
    }
}
