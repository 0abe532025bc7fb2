package com.issuesla.gold.sla;

import java.time.Instant;

public class InvalidRangeException extends RuntimeException {

  private final String issueId;

  public InvalidRangeException(String issueId, Instant start, Instant end) {
    super("end is before start issueId=" + issueId + " start=" + start + " end=" + end);
    this.issueId = issueId;
  }

  public String issueId() {
    return issueId;
  }
}
