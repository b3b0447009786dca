package com.example.reports.export;

import java.math.BigDecimal;

/**
 * A monetary cell value. Spreadsheet output keeps it numeric and attaches a currency number format;
 * CSV output writes the plain amount.
 */
public record CurrencyAmount(BigDecimal amount, String currency) {

  public static CurrencyAmount of(BigDecimal amount, String currency) {
    return new CurrencyAmount(amount, currency);
  }
}
