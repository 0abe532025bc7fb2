/*
 * どこで: SLA ルール層
 * 何を: 解決済み課題に営業時間・期待 SLA・達成可否を付与する
 * なぜ: Gold テーブルの業務ルールを 1 か所に集約し、1 件の不正でバッチを止めないため
 */
package com.issuesla.gold.sla;

import com.issuesla.common.UtcTimestamps;
import com.issuesla.gold.holiday.HolidayCalendar;
import com.issuesla.gold.model.ClassificationError;
import com.issuesla.gold.model.ClassificationErrorCode;
import com.issuesla.gold.model.ClassificationResult;
import com.issuesla.gold.model.ClassifiedIssue;
import com.issuesla.gold.model.Issue;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SlaClassifier {

  private static final Logger logger = LoggerFactory.getLogger(SlaClassifier.class);

  private final HolidayCalendar holidayCalendar;
  private final BusinessDurationCalculator durationCalculator;
  private final SlaPolicy policy;
  private final ClassificationMetrics metrics;

  public SlaClassifier(
      HolidayCalendar holidayCalendar,
      BusinessDurationCalculator durationCalculator,
      SlaPolicy policy,
      ClassificationMetrics metrics) {
    this.holidayCalendar = holidayCalendar;
    this.durationCalculator = durationCalculator;
    this.policy = policy;
    this.metrics = metrics;
  }

  public ClassifiedIssue classify(Issue issue) {
    if (issue == null) {
      throw new IllegalArgumentException("issue is required");
    }
    if (issue.createdAt() == null || !issue.isResolved()) {
      throw new IncompleteIssueException(issue.issueId());
    }
    if (issue.resolvedAt().isBefore(issue.createdAt())) {
      throw new InvalidRangeException(issue.issueId(), issue.createdAt(), issue.resolvedAt());
    }
    // 期待値を先に引き、priority 不正なら祝日取得を起こさない
    final double expectedHours = policy.expectedHours(issue.priority());
    final Set<LocalDate> holidays =
        holidayCalendar.holidaysBetween(
            UtcTimestamps.utcDate(issue.createdAt()).getYear(),
            UtcTimestamps.utcDate(issue.resolvedAt()).getYear());
    final double resolutionHours =
        durationCalculator.businessHours(
            issue.issueId(), issue.createdAt(), issue.resolvedAt(), holidays);
    return new ClassifiedIssue(
        issue, resolutionHours, expectedHours, resolutionHours <= expectedHours);
  }

  public ClassificationResult classifyAll(List<Issue> issues) {
    return classifyAll(issues, 1);
  }

  /**
   * 役割: 課題の一覧を分類し、成功行とレコード単位のエラーを分けて返す。
   * 動作: parallelism が 2 以上ならワーカープールで並列に分類する。出力順は入力順を保つ。
   * 祝日取得の失敗 (ABORT 設定時) だけはバッチ全体を中断する。
   */
  public ClassificationResult classifyAll(List<Issue> issues, int parallelism) {
    final List<Outcome> outcomes =
        parallelism <= 1 || issues.size() <= 1
            ? classifySequentially(issues)
            : classifyInParallel(issues, parallelism);
    final List<ClassifiedIssue> classified = new ArrayList<>(issues.size());
    final List<ClassificationError> errors = new ArrayList<>();
    for (Outcome outcome : outcomes) {
      if (outcome.classified() != null) {
        classified.add(outcome.classified());
        metrics.recordClassificationResult(outcome.classified().slaMet() ? "met" : "violated");
      } else {
        errors.add(outcome.error());
        metrics.recordClassificationResult("error");
      }
    }
    if (!errors.isEmpty()) {
      logger.warn(
          "sla classification finished with errors classified={} errors={}",
          classified.size(),
          errors.size());
    }
    return new ClassificationResult(classified, errors);
  }

  private List<Outcome> classifySequentially(List<Issue> issues) {
    final List<Outcome> outcomes = new ArrayList<>(issues.size());
    for (Issue issue : issues) {
      outcomes.add(classifyCapturingErrors(issue));
    }
    return outcomes;
  }

  private List<Outcome> classifyInParallel(List<Issue> issues, int parallelism) {
    final ExecutorService executor =
        Executors.newFixedThreadPool(Math.min(parallelism, issues.size()));
    try {
      final List<Future<Outcome>> futures = new ArrayList<>(issues.size());
      for (Issue issue : issues) {
        futures.add(executor.submit(() -> classifyCapturingErrors(issue)));
      }
      final List<Outcome> outcomes = new ArrayList<>(issues.size());
      for (Future<Outcome> future : futures) {
        outcomes.add(await(future));
      }
      return outcomes;
    } finally {
      executor.shutdownNow();
    }
  }

  private Outcome await(Future<Outcome> future) {
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("sla classification interrupted", ex);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException) {
        throw (RuntimeException) ex.getCause();
      }
      throw new IllegalStateException("sla classification failed", ex.getCause());
    }
  }

  private Outcome classifyCapturingErrors(Issue issue) {
    try {
      return Outcome.success(classify(issue));
    } catch (InvalidRangeException ex) {
      return reject(issue, ClassificationErrorCode.INVALID_RANGE, ex);
    } catch (UnknownPriorityException ex) {
      return reject(issue, ClassificationErrorCode.UNKNOWN_PRIORITY, ex);
    } catch (IncompleteIssueException ex) {
      return reject(issue, ClassificationErrorCode.INCOMPLETE_ISSUE, ex);
    }
  }

  private Outcome reject(Issue issue, ClassificationErrorCode code, RuntimeException ex) {
    final String issueId = issue == null ? null : issue.issueId();
    logger.warn(
        "sla classification rejected issueId={} code={} reason={}", issueId, code, ex.getMessage());
    return Outcome.failure(new ClassificationError(issueId, code, ex.getMessage()));
  }

  private record Outcome(ClassifiedIssue classified, ClassificationError error) {

    static Outcome success(ClassifiedIssue classified) {
      return new Outcome(classified, null);
    }

    static Outcome failure(ClassificationError error) {
      return new Outcome(null, error);
    }
  }
}
