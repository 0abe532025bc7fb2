package com.issuesla.gold.sla;

/** 分類結果 (met / violated / error) の記録先。 */
@FunctionalInterface
public interface ClassificationMetrics {

  void recordClassificationResult(String result);
}
