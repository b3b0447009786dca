package com.example.reports.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Spending aggregated per merchant. Missing categories are normalized to an empty list.
 */
public record MerchantAnalysisRow(
    String merchant,
    int transactionCount,
    BigDecimal totalSpent,
    BigDecimal averageTransaction,
    LocalDate firstTransaction,
    LocalDate lastTransaction,
    List<String> categories,
    BigDecimal frequencyDays
) implements ReportRow {

    public MerchantAnalysisRow {
        categories = categories == null
            ? List.of()
            : categories.stream().filter(Objects::nonNull).toList();
    }
}
