package com.issuesla.gold.report;

public class ReportSinkException extends RuntimeException {

  public ReportSinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
