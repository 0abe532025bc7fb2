package com.issuesla.common;

import java.util.UUID;

public final class RunIds {

  public static final String MDC_KEY = "run_id";

  private RunIds() {}

  public static String newRunId() {
    return UUID.randomUUID().toString();
  }
}
