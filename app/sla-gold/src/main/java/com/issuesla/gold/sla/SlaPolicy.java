/*
 * どこで: SLA ルール層
 * 何を: 優先度から期待 SLA 時間 (営業時間) を引く不変テーブル
 * なぜ: 閾値をハードコードせず、設定から明示的に構築したポリシーとして扱うため
 */
package com.issuesla.gold.sla;

import com.issuesla.gold.model.Priority;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public final class SlaPolicy {

  private final Map<Priority, Double> expectedHours;

  private SlaPolicy(Map<Priority, Double> expectedHours) {
    this.expectedHours = Collections.unmodifiableMap(new EnumMap<>(expectedHours));
  }

  public static SlaPolicy defaults() {
    return of(24.0d, 72.0d, 120.0d);
  }

  /**
   * 役割: 優先度ごとの閾値からポリシーを構築する。
   * 前提: すべて有限の正の値で、High < Medium < Low の順に厳しいこと。違反時は IllegalArgumentException。
   */
  public static SlaPolicy of(double high, double medium, double low) {
    if (!isPositiveFinite(high) || !isPositiveFinite(medium) || !isPositiveFinite(low)) {
      throw new IllegalArgumentException("sla thresholds must be positive and finite");
    }
    if (!(high < medium && medium < low)) {
      throw new IllegalArgumentException("sla thresholds must satisfy high < medium < low");
    }
    final Map<Priority, Double> table = new EnumMap<>(Priority.class);
    table.put(Priority.HIGH, high);
    table.put(Priority.MEDIUM, medium);
    table.put(Priority.LOW, low);
    return new SlaPolicy(table);
  }

  public double expectedHours(Priority priority) {
    if (priority == null) {
      throw new UnknownPriorityException(null);
    }
    return expectedHours.get(priority);
  }

  public double expectedHours(String priority) {
    return expectedHours(Priority.fromValue(priority));
  }

  public Map<Priority, Double> thresholds() {
    return expectedHours;
  }

  private static boolean isPositiveFinite(double value) {
    return Double.isFinite(value) && value > 0;
  }
}
