package com.example.reports.service;

public class UnsupportedReportFormatException extends ReportRequestException {

  public UnsupportedReportFormatException(String reportFormat) {
    super("Unsupported report format: " + reportFormat);
  }
}
