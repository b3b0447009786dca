package com.example.reports.service;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.example.reports.domain.ReportFormat;
import com.example.reports.domain.ReportType;

class ReportFileNamesTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-01-31T23:30:00Z"), ZoneOffset.UTC);

  @Test
  void fileName_slugsTitleAndAppendsDateAndExtension() {
    assertEquals(
        "income-statement-p-l-2025-01-31.pdf",
        ReportFileNames.fileName(ReportType.INCOME_STATEMENT, ReportFormat.PDF, CLOCK));
    assertEquals(
        "transaction-detail-2025-01-31.xlsx",
        ReportFileNames.fileName(ReportType.TRANSACTION_DETAIL, ReportFormat.XLSX, CLOCK));
  }

  @Test
  void fileName_usesClockZoneForDate() {
    Clock auckland = CLOCK.withZone(ZoneId.of("Pacific/Auckland"));

    assertEquals(
        "balance-sheet-2025-02-01.csv",
        ReportFileNames.fileName(ReportType.BALANCE_SHEET, ReportFormat.CSV, auckland));
  }

  @ParameterizedTest
  @EnumSource(ReportType.class)
  void fileName_isFilesystemSafe(ReportType type) {
    for (ReportFormat format : ReportFormat.values()) {
      assertTrue(
          ReportFileNames.fileName(type, format, CLOCK).matches("[a-z0-9-]+\\.(pdf|csv|xlsx)"));
    }
  }

  @Test
  void slug_collapsesPunctuationAndTrimsHyphens() {
    assertEquals("budget-variance-analysis", ReportFileNames.slug("  Budget Variance Analysis!"));
  }
}
