package com.example.reports.domain;

import java.math.BigDecimal;

public record BudgetVarianceRow(
    String budgetName,
    String categoryName,
    BigDecimal allocated,
    BigDecimal actual,
    BigDecimal variance,
    BigDecimal variancePercentage,
    boolean favorable,
    String period
) implements ReportRow {
}
