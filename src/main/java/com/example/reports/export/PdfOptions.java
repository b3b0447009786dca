package com.example.reports.export;

import java.time.LocalDateTime;

/**
 * Header content and page setup for a PDF report.
 *
 * @param title       report title, always written
 * @param subtitle    optional line under the title
 * @param orientation page orientation
 * @param generatedAt timestamp for the "Generated:" line; {@code null} suppresses the line
 */
public record PdfOptions(
    String title, String subtitle, Orientation orientation, LocalDateTime generatedAt) {

  public enum Orientation {
    PORTRAIT,
    LANDSCAPE
  }

  public PdfOptions {
    if (title == null) {
      throw new IllegalArgumentException("PDF title is required");
    }
    if (orientation == null) {
      orientation = Orientation.PORTRAIT;
    }
  }
}
