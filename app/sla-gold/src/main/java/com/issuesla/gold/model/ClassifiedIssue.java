/*
 * どこで: SLA ドメインモデル
 * 何を: SLA 判定済みの課題 (Gold 行) を表現する
 * なぜ: 集計とレポート出力が同じ不変スナップショットを参照するため
 */
package com.issuesla.gold.model;

public record ClassifiedIssue(
    Issue issue, double resolutionHours, double slaExpectedHours, boolean slaMet) {

  public String issueId() {
    return issue.issueId();
  }

  public String issueType() {
    return issue.issueType();
  }

  public String assigneeName() {
    return issue.assigneeName();
  }
}
