package com.example.reports.domain;

import java.math.BigDecimal;

/**
 * Income statement line. {@code category} is blank on the totals and net-income rows.
 */
public record IncomeStatementRow(
    String section,
    String category,
    BigDecimal amount,
    BigDecimal percentage,
    Integer sortOrder
) implements ReportRow, SectionedRow {

    public enum Section {
        INCOME,
        INCOME_TOTAL,
        EXPENSES,
        EXPENSES_TOTAL,
        NET_INCOME
    }
}
