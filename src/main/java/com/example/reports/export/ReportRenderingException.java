package com.example.reports.export;

/**
 * Raised when a document backend fails to lay out or serialize a report. No partial document is
 * ever returned alongside it.
 */
public class ReportRenderingException extends RuntimeException {

  public ReportRenderingException(String message, Throwable cause) {
    super(message, cause);
  }
}
