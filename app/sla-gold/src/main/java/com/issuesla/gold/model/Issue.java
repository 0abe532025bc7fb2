/*
 * どこで: SLA ドメインモデル
 * 何を: 正規化済みの課題レコード (Silver 行) を表現する
 * なぜ: 取り込み・分類・出力で同じ列構成を共有するため
 */
package com.issuesla.gold.model;

import java.time.Instant;

public record Issue(
    String issueId,
    String issueType,
    String status,
    String priority,
    String assigneeId,
    String assigneeName,
    String assigneeEmail,
    Instant createdAt,
    Instant resolvedAt,
    String projectId,
    String projectName,
    Instant extractedAt) {

  public boolean isResolved() {
    return resolvedAt != null;
  }
}
