package com.issuesla.gold.ingest;

import static com.issuesla.gold.IssueFixtures.issue;
import static org.assertj.core.api.Assertions.assertThat;

import com.issuesla.gold.model.Issue;
import java.util.List;
import org.junit.jupiter.api.Test;

class IssueNormalizerTest {

  private final IssueNormalizer normalizer = new IssueNormalizer();

  private static final String CREATED = "2025-06-02T09:00:00Z";
  private static final String RESOLVED = "2025-06-03T10:00:00Z";

  @Test
  void normalizeKeepsOnlyCompletedAndResolvedIssues() {
    final List<Issue> raw =
        List.of(
            issue("A", "bug", "done", "HIGH", " ana souza ", CREATED, RESOLVED),
            issue("B", "Task", "Resolved", "Low", "Bruno Lima", CREATED, RESOLVED),
            issue("C", "Task", "In Progress", "Low", "Bruno Lima", CREATED, RESOLVED),
            issue("D", "Task", "Done", "Low", "Bruno Lima", CREATED, null),
            issue(" ", "Task", "Done", "Low", "Bruno Lima", CREATED, RESOLVED));

    final List<Issue> normalized = normalizer.normalize(raw);

    assertThat(normalized).extracting(Issue::issueId).containsExactly("A", "B");
    final Issue first = normalized.get(0);
    assertThat(first.issueType()).isEqualTo("Bug");
    assertThat(first.status()).isEqualTo("Done");
    assertThat(first.priority()).isEqualTo("High");
    assertThat(first.assigneeName()).isEqualTo("Ana Souza");
  }

  @Test
  void normalizeKeepsUnknownPriorityForClassifierToReport() {
    final List<Issue> normalized =
        normalizer.normalize(
            List.of(issue("A", "Bug", "Done", "urgent", null, CREATED, RESOLVED)));

    assertThat(normalized)
        .singleElement()
        .satisfies(
            issue -> {
              assertThat(issue.priority()).isEqualTo("Urgent");
              assertThat(issue.assigneeName()).isNull();
            });
  }

  @Test
  void titleCaseHandlesSeparatorsAndNull() {
    assertThat(IssueNormalizer.titleCase("in progress")).isEqualTo("In Progress");
    assertThat(IssueNormalizer.titleCase("SUB-TASK")).isEqualTo("Sub-Task");
    assertThat(IssueNormalizer.titleCase("  maria  da silva ")).isEqualTo("Maria  Da Silva");
    assertThat(IssueNormalizer.titleCase(null)).isNull();
  }
}
