package com.example.reports.export;

import java.awt.Color;

/**
 * Colors, font sizes and page margins shared by the PDF and Excel builders. Passed to each builder
 * explicitly so that a report can be rendered with a different look without touching the builders.
 * Sizes and margins are in points.
 */
public record ReportStyle(
    Color headerBackground,
    Color headerText,
    Color footerBackground,
    Color footerText,
    Color altRowBackground,
    Color borderColor,
    Color mutedText,
    float titleFontSize,
    float subtitleFontSize,
    float timestampFontSize,
    float sectionFontSize,
    float headerFontSize,
    float tableFontSize,
    float textFontSize,
    float marginHorizontal,
    float marginTop,
    float marginBottom) {

  /** Blue header, light gray totals, striped body on A4 with 14mm side margins. */
  public static ReportStyle defaults() {
    return new ReportStyle(
        new Color(59, 130, 246),
        Color.WHITE,
        new Color(229, 231, 235),
        Color.BLACK,
        new Color(245, 245, 245),
        Color.LIGHT_GRAY,
        new Color(128, 128, 128),
        18f,
        12f,
        10f,
        14f,
        10f,
        9f,
        10f,
        40f,
        40f,
        40f);
  }

  public ReportStyle withHeaderBackground(Color color) {
    return new ReportStyle(
        color,
        headerText,
        footerBackground,
        footerText,
        altRowBackground,
        borderColor,
        mutedText,
        titleFontSize,
        subtitleFontSize,
        timestampFontSize,
        sectionFontSize,
        headerFontSize,
        tableFontSize,
        textFontSize,
        marginHorizontal,
        marginTop,
        marginBottom);
  }
}
