/*
 * どこで: SLA Gold サービス層
 * 何を: 取り込み → 正規化 → SLA 分類 → 集計 → 出力を 1 回分実行する
 * なぜ: 各段を差し替え可能なまま、実行単位のログ・メトリクス・結果サマリを 1 か所で扱うため
 */
package com.issuesla.gold.service;

import com.issuesla.common.RunIds;
import com.issuesla.gold.config.PipelineProperties;
import com.issuesla.gold.ingest.IssueNormalizer;
import com.issuesla.gold.ingest.IssueSource;
import com.issuesla.gold.model.ClassificationResult;
import com.issuesla.gold.model.Issue;
import com.issuesla.gold.model.PipelineRunSummary;
import com.issuesla.gold.model.SlaReports;
import com.issuesla.gold.report.ReportSink;
import com.issuesla.gold.sla.SlaAggregator;
import com.issuesla.gold.sla.SlaClassifier;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SlaPipelineService {

  private static final Logger logger = LoggerFactory.getLogger(SlaPipelineService.class);

  private final IssueSource issueSource;
  private final IssueNormalizer normalizer;
  private final SlaClassifier classifier;
  private final SlaAggregator aggregator;
  private final ReportSink reportSink;
  private final PipelineProperties properties;
  private final SlaMetrics metrics;
  private final Clock clock;

  public PipelineRunSummary run() {
    final String runId = RunIds.newRunId();
    final Instant startedAt = Instant.now(clock);
    MDC.put(RunIds.MDC_KEY, runId);
    try {
      logger.info("sla pipeline started input={}", properties.inputPath());
      final List<Issue> rawIssues = issueSource.read();
      final List<Issue> issues = normalizer.normalize(rawIssues);
      final ClassificationResult result =
          classifier.classifyAll(issues, properties.parallelism());
      final SlaReports reports = aggregator.aggregate(result.classified());
      final List<Path> outputs = reportSink.write(result, reports);
      final Duration elapsed = Duration.between(startedAt, Instant.now(clock));
      metrics.recordPipelineRun("success", elapsed);
      logger.info(
          "sla pipeline finished source={} normalized={} classified={} errors={} elapsedMs={}",
          rawIssues.size(),
          issues.size(),
          result.classified().size(),
          result.errors().size(),
          elapsed.toMillis());
      return new PipelineRunSummary(
          runId,
          rawIssues.size(),
          issues.size(),
          result.classified().size(),
          result.errors().size(),
          outputs,
          elapsed);
    } catch (RuntimeException ex) {
      metrics.recordPipelineRun("failure", Duration.between(startedAt, Instant.now(clock)));
      logger.error("sla pipeline failed", ex);
      throw ex;
    } finally {
      MDC.remove(RunIds.MDC_KEY);
    }
  }
}
