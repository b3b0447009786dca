package com.example.reports.domain;

import com.example.reports.service.UnsupportedReportTypeException;

/**
 * The seven financial report kinds, with the metadata shown to users when choosing a report.
 * Each type accepts exactly one row shape.
 */
public enum ReportType {
    INCOME_STATEMENT("income_statement", "Income Statement (P&L)",
        "Profit and loss statement showing income and expenses",
        ReportCategory.FINANCIAL, ReportFormat.PDF, true, false, IncomeStatementRow.class),
    BALANCE_SHEET("balance_sheet", "Balance Sheet",
        "Statement of financial position showing assets and liabilities",
        ReportCategory.FINANCIAL, ReportFormat.PDF, false, false, BalanceSheetRow.class),
    CASH_FLOW("cash_flow", "Cash Flow Statement",
        "Statement of cash flows from operating, investing, and financing activities",
        ReportCategory.FINANCIAL, ReportFormat.PDF, true, false, CashFlowRow.class),
    BUDGET_PERFORMANCE("budget_performance", "Budget Performance",
        "Detailed budget vs actual spending comparison",
        ReportCategory.BUDGET, ReportFormat.PDF, true, false, BudgetPerformanceRow.class),
    BUDGET_VARIANCE("budget_variance", "Budget Variance Analysis",
        "Analysis of budget variances and trends",
        ReportCategory.BUDGET, ReportFormat.PDF, true, false, BudgetVarianceRow.class),
    TRANSACTION_DETAIL("transaction_detail", "Transaction Detail",
        "Detailed list of all transactions with filters",
        ReportCategory.TRANSACTION, ReportFormat.XLSX, true, true, TransactionDetailRow.class),
    MERCHANT_ANALYSIS("merchant_analysis", "Merchant Analysis",
        "Spending analysis by merchant with frequency and patterns",
        ReportCategory.TRANSACTION, ReportFormat.PDF, true, false, MerchantAnalysisRow.class);

    private final String code;
    private final String title;
    private final String description;
    private final ReportCategory category;
    private final ReportFormat defaultFormat;
    private final boolean requiresDateRange;
    private final boolean supportsFilters;
    private final Class<? extends ReportRow> rowType;

    ReportType(String code, String title, String description, ReportCategory category,
               ReportFormat defaultFormat, boolean requiresDateRange, boolean supportsFilters,
               Class<? extends ReportRow> rowType) {
        this.code = code;
        this.title = title;
        this.description = description;
        this.category = category;
        this.defaultFormat = defaultFormat;
        this.requiresDateRange = requiresDateRange;
        this.supportsFilters = supportsFilters;
        this.rowType = rowType;
    }

    public String getCode() {
        return code;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public ReportCategory getCategory() {
        return category;
    }

    public ReportFormat getDefaultFormat() {
        return defaultFormat;
    }

    public boolean isRequiresDateRange() {
        return requiresDateRange;
    }

    public boolean isSupportsFilters() {
        return supportsFilters;
    }

    public Class<? extends ReportRow> getRowType() {
        return rowType;
    }

    /**
     * Resolves a wire code such as {@code "balance_sheet"}.
     *
     * @throws UnsupportedReportTypeException if the code names no known report type
     */
    public static ReportType fromCode(String code) {
        if (code != null) {
            for (ReportType type : values()) {
                if (type.code.equals(code.trim())) {
                    return type;
                }
            }
        }
        throw new UnsupportedReportTypeException(code);
    }
}
