/*
 * どこで: SLA 集計層
 * 何を: 分類済み課題から担当者別・課題種別・達成分布の 3 レポートを作る
 * なぜ: 件数と合計だけの純粋な縮約にして、入力順や並列度に依存しない結果にするため
 */
package com.issuesla.gold.sla;

import com.issuesla.gold.model.ClassifiedIssue;
import com.issuesla.gold.model.SlaDistributionRow;
import com.issuesla.gold.model.SlaGroupRow;
import com.issuesla.gold.model.SlaReports;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

public class SlaAggregator {

  static final String UNASSIGNED = "Unassigned";
  static final String UNKNOWN_TYPE = "Unknown";

  public SlaReports aggregate(Collection<ClassifiedIssue> classified) {
    if (classified == null || classified.isEmpty()) {
      return SlaReports.empty();
    }
    return new SlaReports(byAnalyst(classified), byIssueType(classified), distribution(classified));
  }

  public List<SlaGroupRow> byAnalyst(Collection<ClassifiedIssue> classified) {
    return groupBy(classified, issue -> orDefault(issue.assigneeName(), UNASSIGNED));
  }

  public List<SlaGroupRow> byIssueType(Collection<ClassifiedIssue> classified) {
    return groupBy(classified, issue -> orDefault(issue.issueType(), UNKNOWN_TYPE));
  }

  /**
   * 役割: 達成/未達ごとの件数と構成比 (%) を返す。
   * 動作: 構成比は全分類件数に対する割合を小数第 2 位で丸める。入力が空なら空リストを返し、
   * ゼロ除算は起こさない。行は未達 (false)、達成 (true) の順。
   */
  public List<SlaDistributionRow> distribution(Collection<ClassifiedIssue> classified) {
    if (classified == null || classified.isEmpty()) {
      return List.of();
    }
    final long total = classified.size();
    final Map<Boolean, Long> counts =
        classified.stream()
            .collect(
                Collectors.groupingBy(
                    ClassifiedIssue::slaMet, TreeMap::new, Collectors.counting()));
    final List<SlaDistributionRow> rows = new ArrayList<>(counts.size());
    counts.forEach(
        (slaMet, count) ->
            rows.add(new SlaDistributionRow(slaMet, count, round2(count * 100.0d / total))));
    return rows;
  }

  private List<SlaGroupRow> groupBy(
      Collection<ClassifiedIssue> classified, Function<ClassifiedIssue, String> key) {
    if (classified == null || classified.isEmpty()) {
      return List.of();
    }
    final Map<String, DoubleSummaryStatistics> stats =
        classified.stream()
            .collect(
                Collectors.groupingBy(
                    key,
                    TreeMap::new,
                    Collectors.summarizingDouble(ClassifiedIssue::resolutionHours)));
    final List<SlaGroupRow> rows = new ArrayList<>(stats.size());
    stats.forEach(
        (group, summary) ->
            rows.add(new SlaGroupRow(group, summary.getCount(), summary.getAverage())));
    return rows;
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  // 偶数丸め。ちょうど半端な構成比 (0.125 と 99.875 など) が両方切り上がらないようにする
  static double round2(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
  }
}
