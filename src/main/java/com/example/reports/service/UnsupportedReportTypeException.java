package com.example.reports.service;

public class UnsupportedReportTypeException extends ReportRequestException {

  public UnsupportedReportTypeException(String reportType) {
    super("Unsupported report type: " + reportType);
  }
}
