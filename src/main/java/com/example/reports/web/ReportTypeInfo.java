package com.example.reports.web;

import com.example.reports.domain.ReportType;

/** Report type metadata as listed to clients choosing a report. */
public record ReportTypeInfo(
    String code,
    String title,
    String description,
    String category,
    String defaultFormat,
    boolean requiresDateRange,
    boolean supportsFilters) {

  static ReportTypeInfo of(ReportType type) {
    return new ReportTypeInfo(
        type.getCode(),
        type.getTitle(),
        type.getDescription(),
        type.getCategory().getLabel(),
        type.getDefaultFormat().getCode(),
        type.isRequiresDateRange(),
        type.isSupportsFilters());
  }
}
