/*
 * どこで: SLA 集計モデル
 * 何を: 1 回の実行で得られる 3 種類の集計レポートを束ねる
 * なぜ: 集計結果を実行ごとに丸ごと再計算し、出力先へ一括で渡すため
 */
package com.issuesla.gold.model;

import java.util.List;

public record SlaReports(
    List<SlaGroupRow> byAnalyst,
    List<SlaGroupRow> byIssueType,
    List<SlaDistributionRow> distribution) {

  public SlaReports {
    byAnalyst = List.copyOf(byAnalyst);
    byIssueType = List.copyOf(byIssueType);
    distribution = List.copyOf(distribution);
  }

  public static SlaReports empty() {
    return new SlaReports(List.of(), List.of(), List.of());
  }
}
