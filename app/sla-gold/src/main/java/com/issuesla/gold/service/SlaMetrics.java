/*
 * どこで: SLA Gold サービス層
 * 何を: 分類結果・祝日取得結果・パイプライン実行時間のメトリクスを記録する
 * なぜ: SLA 違反率や祝日 API 劣化を Prometheus から直接観測できるようにするため
 */
package com.issuesla.gold.service;

import com.issuesla.gold.holiday.HolidayFetchMetrics;
import com.issuesla.gold.sla.ClassificationMetrics;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SlaMetrics implements ClassificationMetrics, HolidayFetchMetrics {

  private static final String METRIC_CLASSIFICATION_TOTAL = "sla.classification.total";
  private static final String METRIC_HOLIDAY_FETCH_TOTAL = "sla.holiday.fetch.total";
  private static final String METRIC_PIPELINE_RUN_DURATION = "sla.pipeline.run.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> classificationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> holidayFetchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> pipelineRunTimers = new ConcurrentHashMap<>();

  public SlaMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void recordClassificationResult(String result) {
    classificationCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_CLASSIFICATION_TOTAL)
                    .description("SLA classification outcomes per issue")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  @Override
  public void recordHolidayFetchResult(String result) {
    holidayFetchCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_HOLIDAY_FETCH_TOTAL)
                    .description("Holiday provider fetch outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordPipelineRun(String result, Duration duration) {
    pipelineRunTimers
        .computeIfAbsent(
            result,
            ignored ->
                Timer.builder(METRIC_PIPELINE_RUN_DURATION)
                    .description("SLA gold pipeline run duration")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .record(duration);
  }
}
