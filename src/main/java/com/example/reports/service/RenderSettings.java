package com.example.reports.service;

import java.time.Clock;

import com.example.reports.export.ReportStyle;

/**
 * Rendering settings shared by all report generators.
 *
 * @param style            colors, fonts and margins for PDF and Excel output
 * @param clock            source of the PDF "Generated:" timestamp, document metadata dates and file
 *                         name dates
 * @param includeTimestamp whether PDF headers carry the generation timestamp
 */
public record RenderSettings(ReportStyle style, Clock clock, boolean includeTimestamp) {

  public static RenderSettings defaults(Clock clock) {
    return new RenderSettings(ReportStyle.defaults(), clock, true);
  }
}
