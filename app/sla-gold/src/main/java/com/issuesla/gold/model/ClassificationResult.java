package com.issuesla.gold.model;

import java.util.List;

public record ClassificationResult(
    List<ClassifiedIssue> classified, List<ClassificationError> errors) {

  public ClassificationResult {
    classified = List.copyOf(classified);
    errors = List.copyOf(errors);
  }
}
