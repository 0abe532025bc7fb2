package com.issuesla.gold.ingest;

public class IssueSourceException extends RuntimeException {

  public IssueSourceException(String message) {
    super(message);
  }

  public IssueSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
