package com.example.reports.export;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Currency;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/** Locale-aware display formatting for amounts, dates and percentages. */
public final class ReportFormatter {

  private static final Map<String, Locale> CURRENCY_LOCALES =
      Map.of(
          "USD", Locale.forLanguageTag("en-US"),
          "EUR", Locale.forLanguageTag("en-IE"),
          "GBP", Locale.forLanguageTag("en-GB"),
          "JPY", Locale.forLanguageTag("ja-JP"),
          "INR", Locale.forLanguageTag("en-IN"),
          "CAD", Locale.forLanguageTag("en-CA"),
          "AUD", Locale.forLanguageTag("en-AU"),
          "CHF", Locale.forLanguageTag("de-CH"));

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);

  private ReportFormatter() {}

  /**
   * Formats an amount in the currency's home locale, then adapts the result to what the target
   * surface can draw. A {@code null} amount yields an empty string.
   */
  public static String formatCurrency(BigDecimal amount, String currencyCode, RenderSurface surface) {
    if (amount == null) {
      return "";
    }
    String code = currencyCode == null ? "USD" : currencyCode.toUpperCase(Locale.ROOT);
    Currency currency = resolveCurrency(code);
    if (currency == null) {
      NumberFormat plain = NumberFormat.getNumberInstance(Locale.US);
      plain.setMinimumFractionDigits(2);
      plain.setMaximumFractionDigits(2);
      return surface.adapt(code + " " + plain.format(amount));
    }
    NumberFormat format = NumberFormat.getCurrencyInstance(localeFor(code));
    format.setCurrency(currency);
    format.setMinimumFractionDigits(currency.getDefaultFractionDigits());
    format.setMaximumFractionDigits(currency.getDefaultFractionDigits());
    return surface.adapt(format.format(amount));
  }

  /**
   * Excel number format showing the currency's native symbol, e.g. {@code "₹"#,##0.00}.
   */
  public static String excelCurrencyFormat(String currencyCode) {
    String code = currencyCode == null ? "USD" : currencyCode.toUpperCase(Locale.ROOT);
    Currency currency = resolveCurrency(code);
    if (currency == null) {
      return "\"" + code + " \"#,##0.00";
    }
    String symbol = currency.getSymbol(localeFor(code)).replace("\"", "");
    int digits = currency.getDefaultFractionDigits();
    String pattern = digits > 0 ? "#,##0." + "0".repeat(digits) : "#,##0";
    return "\"" + symbol + "\"" + pattern;
  }

  public static String formatDate(LocalDate date) {
    return date == null ? "" : date.format(DATE_FORMAT);
  }

  /** Two decimal places followed by a percent sign, e.g. {@code 12.50%}. */
  public static String formatPercentage(BigDecimal value) {
    return value == null ? "" : formatDecimal(value, 2) + "%";
  }

  public static String formatDecimal(BigDecimal value, int decimals) {
    return value == null ? "" : value.setScale(decimals, RoundingMode.HALF_UP).toPlainString();
  }

  /**
   * Plain text of a cell value as written to CSV and used to size spreadsheet columns. Numbers are
   * written without grouping or currency symbols.
   */
  public static String plainText(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    if (value instanceof CurrencyAmount money) {
      return money.amount() == null ? "" : money.amount().toPlainString();
    }
    if (value instanceof Collection<?> values) {
      return values.stream().map(ReportFormatter::plainText).collect(Collectors.joining(", "));
    }
    return String.valueOf(value);
  }

  /** Cuts text to at most {@code maxLength} characters. */
  public static String truncate(String text, int maxLength) {
    if (text == null) {
      return "";
    }
    return text.length() <= maxLength ? text : text.substring(0, maxLength);
  }

  static Locale localeFor(String currencyCode) {
    return CURRENCY_LOCALES.getOrDefault(currencyCode, Locale.US);
  }

  private static Currency resolveCurrency(String code) {
    try {
      return Currency.getInstance(code);
    } catch (IllegalArgumentException e) {
      // not an ISO 4217 code; callers fall back to a plain code prefix
      return null;
    }
  }
}
