package com.issuesla.gold.model;

public enum ClassificationErrorCode {
  INVALID_RANGE,
  UNKNOWN_PRIORITY,
  INCOMPLETE_ISSUE
}
