package com.example.reports.domain;

/**
 * One pre-aggregated row handed to the compiler by the data-aggregation layer. Rows are final:
 * amounts are already rounded and percentages already computed.
 */
public sealed interface ReportRow
    permits IncomeStatementRow, BalanceSheetRow, CashFlowRow, BudgetPerformanceRow,
        BudgetVarianceRow, TransactionDetailRow, MerchantAnalysisRow {
}
