package com.example.reports.export;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

class ReportFormatterTest {

  @Test
  void formatCurrency_usd() {
    assertEquals(
        "$1,234.50", ReportFormatter.formatCurrency(new BigDecimal("1234.5"), "USD", RenderSurface.PDF));
  }

  @Test
  void formatCurrency_inrOnPdfFallsBackToAsciiPrefix() {
    String formatted =
        ReportFormatter.formatCurrency(new BigDecimal("1000"), "INR", RenderSurface.PDF);

    assertFalse(formatted.contains("₹"));
    assertTrue(formatted.contains("Rs."));
    assertTrue(formatted.contains("1,000.00"));
  }

  @Test
  void formatCurrency_inrOutsidePdfKeepsRupeeSign() {
    String csv = ReportFormatter.formatCurrency(new BigDecimal("1000"), "INR", RenderSurface.CSV);
    String xlsx = ReportFormatter.formatCurrency(new BigDecimal("1000"), "INR", RenderSurface.XLSX);

    assertTrue(csv.contains("₹"));
    assertEquals(csv, xlsx);
  }

  @Test
  void formatCurrency_yenHasNoDecimals() {
    String formatted =
        ReportFormatter.formatCurrency(new BigDecimal("1234"), "JPY", RenderSurface.PDF);

    assertTrue(formatted.endsWith("1,234"));
    assertFalse(formatted.contains("￥"));
  }

  @Test
  void formatCurrency_lowerCaseCodeIsAccepted() {
    assertEquals(
        ReportFormatter.formatCurrency(BigDecimal.TEN, "USD", RenderSurface.CSV),
        ReportFormatter.formatCurrency(BigDecimal.TEN, "usd", RenderSurface.CSV));
  }

  @Test
  void formatCurrency_unknownCodeIsPrefixed() {
    assertEquals(
        "QQQ 1,000.00",
        ReportFormatter.formatCurrency(new BigDecimal("1000"), "QQQ", RenderSurface.PDF));
  }

  @Test
  void formatCurrency_nullAmountIsEmpty() {
    assertEquals("", ReportFormatter.formatCurrency(null, "USD", RenderSurface.PDF));
  }

  @Test
  void excelCurrencyFormat_usesNativeSymbol() {
    assertEquals("\"$\"#,##0.00", ReportFormatter.excelCurrencyFormat("USD"));
    assertTrue(ReportFormatter.excelCurrencyFormat("INR").contains("₹"));
    assertTrue(ReportFormatter.excelCurrencyFormat("JPY").endsWith("#,##0"));
  }

  @Test
  void formatDate_usesShortMonthName() {
    assertEquals("Jan 5, 2025", ReportFormatter.formatDate(LocalDate.of(2025, 1, 5)));
    assertEquals("", ReportFormatter.formatDate(null));
  }

  @Test
  void formatPercentage_twoDecimals() {
    assertEquals("12.50%", ReportFormatter.formatPercentage(new BigDecimal("12.5")));
    assertEquals("33.33%", ReportFormatter.formatPercentage(new BigDecimal("33.333")));
  }

  @Test
  void plainText_writesNumbersWithoutGroupingOrExponent() {
    assertEquals("1000", ReportFormatter.plainText(new BigDecimal("1E+3")));
    assertEquals("42.10", ReportFormatter.plainText(CurrencyAmount.of(new BigDecimal("42.10"), "EUR")));
    assertEquals("food, weekly", ReportFormatter.plainText(List.of("food", "weekly")));
    assertEquals("", ReportFormatter.plainText(null));
  }

  @Test
  void truncate_cutsLongText() {
    assertEquals("abc", ReportFormatter.truncate("abcdef", 3));
    assertEquals("ab", ReportFormatter.truncate("ab", 3));
    assertEquals("", ReportFormatter.truncate(null, 3));
  }
}
