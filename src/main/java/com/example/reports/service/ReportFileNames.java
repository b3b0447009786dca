package com.example.reports.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;

import com.example.reports.domain.ReportFormat;
import com.example.reports.domain.ReportType;

/** Suggested download names, e.g. {@code income-statement-p-l-2025-01-31.pdf}. */
public final class ReportFileNames {

  private ReportFileNames() {}

  public static String fileName(ReportType type, ReportFormat format, Clock clock) {
    return slug(type.getTitle()) + "-" + LocalDate.now(clock) + "." + format.getFileExtension();
  }

  /** Lower-case words joined by single hyphens; anything outside {@code [a-z0-9]} separates words. */
  static String slug(String text) {
    String slug = text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    return slug.replaceAll("^-+|-+$", "");
  }
}
