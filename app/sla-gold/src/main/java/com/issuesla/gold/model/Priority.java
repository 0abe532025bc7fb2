/*
 * どこで: SLA ドメインモデル
 * 何を: 課題の優先度を定義する
 * なぜ: priority 入力の妥当性を列挙型で固定し、未知の値を黙って既定値にしないため
 */
package com.issuesla.gold.model;

import com.issuesla.gold.sla.UnknownPriorityException;

public enum Priority {
  HIGH("High"),
  MEDIUM("Medium"),
  LOW("Low");

  private final String value;

  Priority(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: エクスポート由来の priority 文字列を内部列挙型へ変換する。
   * 動作: 前後の空白を除き、大文字小文字を無視して一致判定を行う。未対応値・空・null は
   * UnknownPriorityException を送出する。
   */
  public static Priority fromValue(String priority) {
    if (priority != null) {
      final String trimmed = priority.trim();
      for (Priority candidate : values()) {
        if (candidate.value.equalsIgnoreCase(trimmed)) {
          return candidate;
        }
      }
    }
    throw new UnknownPriorityException(priority);
  }
}
