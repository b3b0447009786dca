package com.example.reports.domain;

import java.math.BigDecimal;

public record CashFlowRow(
    String section,
    String item,
    BigDecimal amount,
    Integer sortOrder
) implements ReportRow, SectionedRow {

    public enum Section {
        OPERATING,
        OPERATING_TOTAL,
        INVESTING,
        BALANCE,        // Beginning cash balance
        BALANCE_END     // Ending cash balance
    }
}
