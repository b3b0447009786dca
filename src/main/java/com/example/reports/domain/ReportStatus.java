package com.example.reports.domain;

/**
 * Lifecycle states reported to the generation audit trail.
 */
public enum ReportStatus {
    COMPLETED,
    FAILED
}
