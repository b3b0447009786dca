package com.example.reports.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Parameters a report was requested with. The compiler only reads them to build header text; it
 * never recomputes data from them.
 *
 * @param startDate       start of the reporting period
 * @param endDate         end of the reporting period
 * @param asOfDate        point-in-time date for the balance sheet
 * @param currency        ISO 4217 code, {@code USD} when absent
 * @param limit           maximum merchant rows requested upstream
 * @param accountIds      account filter for transaction reports
 * @param categoryIds     category filter for transaction reports
 * @param transactionType income, expense or transfer filter for transaction reports
 */
public record ReportParameters(
    LocalDate startDate,
    LocalDate endDate,
    LocalDate asOfDate,
    String currency,
    Integer limit,
    List<String> accountIds,
    List<String> categoryIds,
    String transactionType
) {

    public static final String DEFAULT_CURRENCY = "USD";

    public ReportParameters {
        currency = currency == null || currency.isBlank()
            ? DEFAULT_CURRENCY
            : currency.trim().toUpperCase(Locale.ROOT);
        accountIds = accountIds == null ? List.of() : List.copyOf(accountIds);
        categoryIds = categoryIds == null ? List.of() : List.copyOf(categoryIds);
    }

    public static ReportParameters forPeriod(LocalDate startDate, LocalDate endDate, String currency) {
        return new ReportParameters(startDate, endDate, null, currency, null, null, null, null);
    }

    public static ReportParameters asOf(LocalDate asOfDate, String currency) {
        return new ReportParameters(null, null, asOfDate, currency, null, null, null, null);
    }

    /**
     * The balance sheet date, falling back to the period end when no as-of date was given.
     */
    public LocalDate effectiveAsOfDate() {
        return asOfDate != null ? asOfDate : endDate;
    }
}
