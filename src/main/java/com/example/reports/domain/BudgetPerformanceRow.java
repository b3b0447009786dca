package com.example.reports.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One category line of a budget. Rows are grouped by {@code budgetName}; the period is taken from
 * the first row of each group.
 */
public record BudgetPerformanceRow(
    String budgetName,
    String categoryName,
    BigDecimal allocated,
    BigDecimal spent,
    BigDecimal remaining,
    BigDecimal percentageUsed,
    String status,
    LocalDate periodStart,
    LocalDate periodEnd
) implements ReportRow {

    public static final String STATUS_ON_TRACK = "On Track";
    public static final String STATUS_WARNING = "Warning";
    public static final String STATUS_OVER_BUDGET = "Over Budget";
}
