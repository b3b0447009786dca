package com.example.reports.domain;

import java.math.BigDecimal;

/**
 * Balance sheet line: an asset or liability account, a section total or the net worth figure.
 */
public record BalanceSheetRow(
    String section,
    String item,
    BigDecimal amount,
    BigDecimal percentage,
    Integer sortOrder
) implements ReportRow, SectionedRow {

    public enum Section {
        ASSETS,
        ASSETS_TOTAL,
        LIABILITIES,
        LIABILITIES_TOTAL,
        NET_WORTH
    }
}
