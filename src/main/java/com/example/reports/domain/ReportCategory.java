package com.example.reports.domain;

/**
 * Grouping used when listing the available report types.
 */
public enum ReportCategory {
    FINANCIAL("Financial Statements"),
    BUDGET("Budget Reports"),
    TRANSACTION("Transaction Reports");

    private final String label;

    ReportCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
