package com.issuesla.gold;

import com.issuesla.gold.config.HolidayProperties;
import com.issuesla.gold.holiday.HolidayFetchFailurePolicy;
import com.issuesla.gold.model.Issue;
import java.time.Duration;
import java.time.Instant;

public final class IssueFixtures {

  private IssueFixtures() {}

  public static Issue resolvedIssue(
      String issueId, String priority, String createdAt, String resolvedAt) {
    return issue(issueId, "Bug", "Done", priority, "Ana Souza", createdAt, resolvedAt);
  }

  public static Issue issue(
      String issueId,
      String issueType,
      String status,
      String priority,
      String assigneeName,
      String createdAt,
      String resolvedAt) {
    return new Issue(
        issueId,
        issueType,
        status,
        priority,
        "acc-" + issueId,
        assigneeName,
        "analyst@example.com",
        createdAt == null ? null : Instant.parse(createdAt),
        resolvedAt == null ? null : Instant.parse(resolvedAt),
        "PRJ-1",
        "Service Desk",
        Instant.parse("2025-02-01T00:00:00Z"));
  }

  public static HolidayProperties holidayProperties(
      HolidayFetchFailurePolicy policy, int maxAttempts) {
    return new HolidayProperties(
        "http://holidays.test",
        "/api/feriados/v1/{year}",
        "BR",
        policy,
        maxAttempts,
        Duration.ofMillis(1),
        Duration.ofMillis(2),
        Duration.ofSeconds(1),
        Duration.ofSeconds(1));
  }
}
