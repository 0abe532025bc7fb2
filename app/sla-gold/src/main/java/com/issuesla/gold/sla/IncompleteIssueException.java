/*
 * どこで: SLA ルール層
 * 何を: resolved_at を持たない課題が分類に渡されたことを表現する
 * なぜ: 上流フィルタの不具合を検知しつつ、該当レコードだけを除外するため
 */
package com.issuesla.gold.sla;

public class IncompleteIssueException extends RuntimeException {

  private final String issueId;

  public IncompleteIssueException(String issueId) {
    super("issue has no resolved_at issueId=" + issueId);
    this.issueId = issueId;
  }

  public String issueId() {
    return issueId;
  }
}
