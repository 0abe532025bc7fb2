/*
 * どこで: SLA ルール層
 * 何を: High/Medium/Low 以外の priority を表現する
 * なぜ: データ品質エラーを既定値で隠さず、呼び出し側へ明示するため
 */
package com.issuesla.gold.sla;

public class UnknownPriorityException extends RuntimeException {

  private final String priority;

  public UnknownPriorityException(String priority) {
    super("unknown priority: " + priority);
    this.priority = priority;
  }

  public String priority() {
    return priority;
  }
}
