package com.issuesla.gold.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public record PipelineRunSummary(
    String runId,
    int sourceCount,
    int normalizedCount,
    int classifiedCount,
    int errorCount,
    List<Path> outputs,
    Duration elapsed) {

  public PipelineRunSummary {
    outputs = List.copyOf(outputs);
  }
}
