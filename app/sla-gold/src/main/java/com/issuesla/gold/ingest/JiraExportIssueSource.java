/*
 * どこで: 取り込み層 (Bronze)
 * 何を: Jira エクスポート JSON を読み、定義済みの列だけを課題レコードへ写す
 * なぜ: assignee/timestamps がオブジェクトでも配列でも来るエクスポート揺れを 1 か所で吸収するため
 */
package com.issuesla.gold.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.issuesla.common.UtcTimestamps;
import com.issuesla.gold.config.PipelineProperties;
import com.issuesla.gold.model.Issue;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JiraExportIssueSource implements IssueSource {

  private static final Logger logger = LoggerFactory.getLogger(JiraExportIssueSource.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final PipelineProperties properties;

  public JiraExportIssueSource(ObjectMapper objectMapper, PipelineProperties properties) {
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public List<Issue> read() {
    final Path inputPath = properties.inputPath();
    if (!Files.isRegularFile(inputPath)) {
      throw new IssueSourceException("input export not found: " + inputPath.toAbsolutePath());
    }
    try (InputStream in = Files.newInputStream(inputPath)) {
      final List<Issue> issues = parse(objectMapper.readTree(in));
      logger.info("jira export read path={} issues={}", inputPath, issues.size());
      return issues;
    } catch (IOException ex) {
      throw new IssueSourceException("failed to read input export: " + inputPath, ex);
    }
  }

  List<Issue> parse(JsonNode payload) {
    if (payload == null || !payload.isObject()) {
      throw new IssueSourceException("input export must be a json object");
    }
    final JsonNode project = payload.path("project");
    final String projectId = text(project, "project_id");
    final String projectName = text(project, "project_name");
    final Instant extractedAt = timestamp(project, "extracted_at");
    final JsonNode issuesNode = payload.path("issues");
    if (!issuesNode.isMissingNode() && !issuesNode.isArray()) {
      throw new IssueSourceException("issues must be a json array");
    }
    final List<Issue> issues = new ArrayList<>();
    for (JsonNode issue : issuesNode) {
      final JsonNode timestamps = firstOrSelf(issue.path("timestamps"));
      final JsonNode assignee = firstOrSelf(issue.path("assignee"));
      issues.add(
          new Issue(
              text(issue, "id"),
              text(issue, "issue_type"),
              text(issue, "status"),
              text(issue, "priority"),
              text(assignee, "id"),
              text(assignee, "name"),
              text(assignee, "email"),
              timestamp(timestamps, "created_at"),
              timestamp(timestamps, "resolved_at"),
              projectId,
              projectName,
              extractedAt));
    }
    return issues;
  }

  // 配列なら先頭要素、オブジェクトならそのまま、それ以外は欠損扱い
  private JsonNode firstOrSelf(JsonNode node) {
    if (node.isArray()) {
      return node.size() > 0 ? node.get(0) : MissingNode.getInstance();
    }
    if (node.isObject()) {
      return node;
    }
    return MissingNode.getInstance();
  }

  private String text(JsonNode node, String field) {
    final JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return null;
    }
    return value.asText();
  }

  private Instant timestamp(JsonNode node, String field) {
    return UtcTimestamps.parse(text(node, field)).orElse(null);
  }
}
