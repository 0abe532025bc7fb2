/*
 * どこで: SLA Gold 設定
 * 何を: 優先度別の期待 SLA 時間 (営業時間) を保持する
 * なぜ: 閾値を環境ごとに上書き可能にしつつ、正値かつ High < Medium < Low を起動時に保証するため
 */
package com.issuesla.gold.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "sla.thresholds")
@Validated
public record SlaThresholdProperties(
    @NotNull @Positive Double high,
    @NotNull @Positive Double medium,
    @NotNull @Positive Double low) {

  public SlaThresholdProperties {
    high = high == null ? 24.0d : high;
    medium = medium == null ? 72.0d : medium;
    low = low == null ? 120.0d : low;
  }

  @AssertTrue(message = "sla.thresholds must satisfy high < medium < low")
  public boolean isStrictlyOrdered() {
    return high != null && medium != null && low != null && high < medium && medium < low;
  }
}
