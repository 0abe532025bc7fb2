package com.issuesla.gold.sla;

import static com.issuesla.gold.IssueFixtures.issue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.issuesla.gold.model.ClassifiedIssue;
import com.issuesla.gold.model.SlaDistributionRow;
import com.issuesla.gold.model.SlaGroupRow;
import com.issuesla.gold.model.SlaReports;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SlaAggregatorTest {

  private final SlaAggregator aggregator = new SlaAggregator();

  @Test
  void byAnalystCountsAndAveragesResolutionHours() {
    final List<SlaGroupRow> rows = aggregator.byAnalyst(sample());

    assertThat(rows)
        .containsExactly(
            new SlaGroupRow("Ana Souza", 3, 56.0d),
            new SlaGroupRow("Bruno Lima", 1, 48.0d),
            new SlaGroupRow(SlaAggregator.UNASSIGNED, 1, 72.0d));
  }

  @Test
  void byIssueTypeCountsAndAveragesResolutionHours() {
    final List<SlaGroupRow> rows = aggregator.byIssueType(sample());

    assertThat(rows)
        .containsExactly(
            new SlaGroupRow("Bug", 2, 36.0d),
            new SlaGroupRow("Incident", 1, 120.0d),
            new SlaGroupRow("Task", 2, 48.0d));
  }

  @Test
  void distributionReportsCountsAndPercentagesSummingToHundred() {
    final List<SlaDistributionRow> rows = aggregator.distribution(sample());

    assertThat(rows)
        .containsExactly(
            new SlaDistributionRow(false, 2, 40.0d), new SlaDistributionRow(true, 3, 60.0d));
    assertThat(rows.stream().mapToDouble(SlaDistributionRow::percentage).sum())
        .isCloseTo(100.0d, within(1e-9));
  }

  @Test
  void distributionRoundsPercentagesToTwoDecimals() {
    final List<ClassifiedIssue> classified =
        List.of(
            classified("1", "Bug", "Ana Souza", 24.0d, true),
            classified("2", "Bug", "Ana Souza", 24.0d, true),
            classified("3", "Bug", "Ana Souza", 96.0d, false));

    final List<SlaDistributionRow> rows = aggregator.distribution(classified);

    assertThat(rows).extracting(SlaDistributionRow::percentage).containsExactly(33.33d, 66.67d);
    assertThat(rows.stream().mapToDouble(SlaDistributionRow::percentage).sum())
        .isCloseTo(100.0d, within(1e-9));
  }

  @Test
  void distributionRoundsExactHalvesToEvenSoSharesStillSumToHundred() {
    final List<ClassifiedIssue> classified = new ArrayList<>();
    classified.add(classified("0", "Bug", "Ana Souza", 96.0d, false));
    for (int i = 1; i < 800; i++) {
      classified.add(classified(String.valueOf(i), "Bug", "Ana Souza", 24.0d, true));
    }

    final List<SlaDistributionRow> rows = aggregator.distribution(classified);

    // 0.125% と 99.875% はどちらも切り上げず 0.12 / 99.88 になる
    assertThat(rows).extracting(SlaDistributionRow::percentage).containsExactly(0.12d, 99.88d);
    assertThat(rows.stream().mapToDouble(SlaDistributionRow::percentage).sum())
        .isCloseTo(100.0d, within(1e-9));
  }

  @Test
  void averageResolutionHoursIsTheUnroundedMean() {
    final List<ClassifiedIssue> classified = new ArrayList<>();
    classified.add(classified("0", "Bug", "Ana Souza", 24.0d, true));
    for (int i = 1; i <= 6; i++) {
      classified.add(classified(String.valueOf(i), "Bug", "Ana Souza", 48.0d, false));
    }

    final List<SlaGroupRow> rows = aggregator.byAnalyst(classified);

    assertThat(rows).singleElement().satisfies(
        row -> {
          assertThat(row.issueCount()).isEqualTo(7L);
          assertThat(row.avgResolutionHours()).isCloseTo(312.0d / 7.0d, within(1e-12));
        });
  }

  @Test
  void emptyInputYieldsEmptyReportsWithoutDivision() {
    final SlaReports reports = aggregator.aggregate(List.of());

    assertThat(reports.byAnalyst()).isEmpty();
    assertThat(reports.byIssueType()).isEmpty();
    assertThat(reports.distribution()).isEmpty();
    assertThat(aggregator.distribution(List.of())).isEmpty();
  }

  @Test
  void reportsAreInvariantUnderInputPermutation() {
    final List<ClassifiedIssue> original = sample();
    final SlaReports expected = aggregator.aggregate(original);
    final Random random = new Random(42L);

    for (int i = 0; i < 20; i++) {
      final List<ClassifiedIssue> shuffled = new ArrayList<>(original);
      Collections.shuffle(shuffled, random);
      assertThat(aggregator.aggregate(shuffled)).isEqualTo(expected);
    }
  }

  private List<ClassifiedIssue> sample() {
    return List.of(
        classified("1", "Bug", "Ana Souza", 24.0d, true),
        classified("2", "Bug", "Bruno Lima", 48.0d, false),
        classified("3", "Task", "Ana Souza", 24.0d, true),
        classified("4", "Task", null, 72.0d, true),
        classified("5", "Incident", "Ana Souza", 120.0d, false));
  }

  private ClassifiedIssue classified(
      String id, String issueType, String assigneeName, double hours, boolean slaMet) {
    return new ClassifiedIssue(
        issue(
            id,
            issueType,
            "Done",
            "High",
            assigneeName,
            "2025-01-06T00:00:00Z",
            "2025-01-07T00:00:00Z"),
        hours,
        24.0d,
        slaMet);
  }
}
