/*
 * どこで: SLA Gold 設定
 * 何を: SLA ルール層 (祝日カレンダーから集計器まで) と実行時計を組み立てる
 * なぜ: ルール層をフレームワーク非依存のまま保ち、設定値から明示的に構築するため
 */
package com.issuesla.gold.config;

import com.issuesla.gold.holiday.HolidayCalendar;
import com.issuesla.gold.holiday.HolidayProvider;
import com.issuesla.gold.service.SlaMetrics;
import com.issuesla.gold.sla.BusinessDurationCalculator;
import com.issuesla.gold.sla.SlaAggregator;
import com.issuesla.gold.sla.SlaClassifier;
import com.issuesla.gold.sla.SlaPolicy;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SlaEngineConfig {

  // 実行時間の計測と run サマリは UTC の時計で揃える
  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  SlaPolicy slaPolicy(SlaThresholdProperties thresholds) {
    return SlaPolicy.of(thresholds.high(), thresholds.medium(), thresholds.low());
  }

  @Bean
  BusinessDurationCalculator businessDurationCalculator(BusinessHoursProperties properties) {
    return new BusinessDurationCalculator(
        properties.mode(), properties.windowStart(), properties.windowEnd());
  }

  @Bean
  HolidayCalendar holidayCalendar(
      HolidayProvider holidayProvider, HolidayProperties properties, SlaMetrics metrics) {
    return new HolidayCalendar(holidayProvider, properties, metrics);
  }

  @Bean
  SlaClassifier slaClassifier(
      HolidayCalendar holidayCalendar,
      BusinessDurationCalculator durationCalculator,
      SlaPolicy slaPolicy,
      SlaMetrics metrics) {
    return new SlaClassifier(holidayCalendar, durationCalculator, slaPolicy, metrics);
  }

  @Bean
  SlaAggregator slaAggregator() {
    return new SlaAggregator();
  }
}
