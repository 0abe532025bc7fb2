/*
 * どこで: 正規化層 (Silver)
 * 何を: 区分列を Title Case に揃え、分類対象 (Done/Resolved かつ resolved_at あり) に絞り込む
 * なぜ: Gold の業務ルールへ正規形の課題だけを渡すため
 */
package com.issuesla.gold.ingest;

import com.google.common.annotations.VisibleForTesting;
import com.issuesla.gold.model.Issue;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class IssueNormalizer {

  private static final Logger logger = LoggerFactory.getLogger(IssueNormalizer.class);
  private static final Set<String> COMPLETED_STATUSES = Set.of("Done", "Resolved");

  public List<Issue> normalize(List<Issue> rawIssues) {
    final List<Issue> normalized = new ArrayList<>(rawIssues.size());
    int missingId = 0;
    int notCompleted = 0;
    int unresolved = 0;
    for (Issue raw : rawIssues) {
      if (raw.issueId() == null || raw.issueId().isBlank()) {
        missingId++;
        continue;
      }
      final Issue issue = canonicalize(raw);
      if (!COMPLETED_STATUSES.contains(issue.status())) {
        notCompleted++;
        continue;
      }
      if (!issue.isResolved()) {
        unresolved++;
        continue;
      }
      normalized.add(issue);
    }
    logger.info(
        "issues normalized kept={} droppedMissingId={} droppedNotCompleted={} droppedUnresolved={}",
        normalized.size(),
        missingId,
        notCompleted,
        unresolved);
    return normalized;
  }

  @VisibleForTesting
  Issue canonicalize(Issue raw) {
    return new Issue(
        raw.issueId().trim(),
        titleCase(raw.issueType()),
        titleCase(raw.status()),
        titleCase(raw.priority()),
        raw.assigneeId(),
        titleCase(raw.assigneeName()),
        raw.assigneeEmail() == null ? null : raw.assigneeEmail().trim(),
        raw.createdAt(),
        raw.resolvedAt(),
        raw.projectId(),
        raw.projectName(),
        raw.extractedAt());
  }

  /** 単語の先頭を大文字、残りを小文字にする ("in progress" は "In Progress")。 */
  @VisibleForTesting
  static String titleCase(String value) {
    if (value == null) {
      return null;
    }
    final String trimmed = value.trim();
    final StringBuilder builder = new StringBuilder(trimmed.length());
    boolean startOfWord = true;
    for (int i = 0; i < trimmed.length(); i++) {
      final char c = trimmed.charAt(i);
      if (Character.isLetter(c)) {
        builder.append(
            startOfWord
                ? String.valueOf(c).toUpperCase(Locale.ROOT)
                : String.valueOf(c).toLowerCase(Locale.ROOT));
        startOfWord = false;
      } else {
        builder.append(c);
        startOfWord = true;
      }
    }
    return builder.toString();
  }
}
