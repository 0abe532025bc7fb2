/*
 * どこで: 出力層 (Gold)
 * 何を: Gold テーブル・3 種の集計・分類エラーを CSV として書き出す
 * なぜ: データ辞書どおりの列名と列順で下流へ渡すため
 */
package com.issuesla.gold.report;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.issuesla.common.UtcTimestamps;
import com.issuesla.gold.config.PipelineProperties;
import com.issuesla.gold.model.ClassificationError;
import com.issuesla.gold.model.ClassificationResult;
import com.issuesla.gold.model.ClassifiedIssue;
import com.issuesla.gold.model.Issue;
import com.issuesla.gold.model.SlaDistributionRow;
import com.issuesla.gold.model.SlaGroupRow;
import com.issuesla.gold.model.SlaReports;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CsvReportSink implements ReportSink {

  static final String GOLD_FILE = "gold_sla_issues.csv";
  static final String REPORT_ANALYST = "gold_sla_by_analyst.csv";
  static final String REPORT_ISSUE_TYPE = "gold_sla_by_issue_type.csv";
  static final String REPORT_DISTRIBUTION = "gold_sla_distribution.csv";
  static final String ERRORS_FILE = "gold_sla_errors.csv";

  static final List<String> GOLD_COLUMNS =
      List.of(
          "issue_id",
          "issue_type",
          "status",
          "priority",
          "assignee_id",
          "assignee_name",
          "assignee_email",
          "created_at",
          "resolved_at",
          "resolution_hours",
          "sla_expected_hours",
          "is_sla_met");

  private static final Logger logger = LoggerFactory.getLogger(CsvReportSink.class);

  // 区切り文字・引用符・改行を含む値だけを引用符で囲む
  private final CsvMapper csvMapper =
      CsvMapper.builder().enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING).build();
  private final PipelineProperties properties;

  public CsvReportSink(PipelineProperties properties) {
    this.properties = properties;
  }

  @Override
  public List<Path> write(ClassificationResult result, SlaReports reports) {
    final Path outputDir = properties.outputDir();
    try {
      Files.createDirectories(outputDir);
    } catch (IOException ex) {
      throw new ReportSinkException("failed to create output dir: " + outputDir, ex);
    }
    final List<Path> outputs = new ArrayList<>();
    outputs.add(
        writeRows(outputDir.resolve(GOLD_FILE), GOLD_COLUMNS, result.classified(), this::goldRow));
    outputs.add(
        writeRows(
            outputDir.resolve(REPORT_ANALYST),
            List.of("assignee_name", "issue_count", "avg_resolution_hours"),
            reports.byAnalyst(),
            row -> groupRow("assignee_name", row)));
    outputs.add(
        writeRows(
            outputDir.resolve(REPORT_ISSUE_TYPE),
            List.of("issue_type", "issue_count", "avg_resolution_hours"),
            reports.byIssueType(),
            row -> groupRow("issue_type", row)));
    outputs.add(
        writeRows(
            outputDir.resolve(REPORT_DISTRIBUTION),
            List.of("is_sla_met", "issue_count", "percentage"),
            reports.distribution(),
            this::distributionRow));
    outputs.add(
        writeRows(
            outputDir.resolve(ERRORS_FILE),
            List.of("issue_id", "error_code", "message"),
            result.errors(),
            this::errorRow));
    for (Path output : outputs) {
      logger.info("gold output generated path={}", output);
    }
    return outputs;
  }

  private <T> Path writeRows(
      Path target, List<String> columns, List<T> rows, Function<T, Map<String, Object>> mapper) {
    final CsvSchema.Builder schemaBuilder = CsvSchema.builder().setUseHeader(false);
    for (String column : columns) {
      schemaBuilder.addColumn(column);
    }
    final CsvSchema schema = schemaBuilder.build();
    try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      // 行が 0 件でもヘッダーは出すため、ヘッダー行は自前で書く
      writer.write(String.join(String.valueOf(schema.getColumnSeparator()), columns));
      writer.write(schema.getLineSeparator());
      writeBody(writer, schema, rows, mapper);
    } catch (IOException ex) {
      throw new ReportSinkException("failed to write " + target, ex);
    }
    return target;
  }

  private <T> void writeBody(
      Writer writer, CsvSchema schema, List<T> rows, Function<T, Map<String, Object>> mapper)
      throws IOException {
    try (SequenceWriter sequence = csvMapper.writer(schema).writeValues(writer)) {
      for (T row : rows) {
        sequence.write(mapper.apply(row));
      }
    }
  }

  private Map<String, Object> goldRow(ClassifiedIssue classified) {
    final Issue issue = classified.issue();
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("issue_id", issue.issueId());
    row.put("issue_type", issue.issueType());
    row.put("status", issue.status());
    row.put("priority", issue.priority());
    row.put("assignee_id", issue.assigneeId());
    row.put("assignee_name", issue.assigneeName());
    row.put("assignee_email", issue.assigneeEmail());
    row.put("created_at", UtcTimestamps.format(issue.createdAt()));
    row.put("resolved_at", UtcTimestamps.format(issue.resolvedAt()));
    row.put("resolution_hours", classified.resolutionHours());
    row.put("sla_expected_hours", classified.slaExpectedHours());
    row.put("is_sla_met", classified.slaMet());
    return row;
  }

  private Map<String, Object> groupRow(String groupColumn, SlaGroupRow group) {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put(groupColumn, group.group());
    row.put("issue_count", group.issueCount());
    row.put("avg_resolution_hours", group.avgResolutionHours());
    return row;
  }

  private Map<String, Object> distributionRow(SlaDistributionRow distribution) {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("is_sla_met", distribution.slaMet());
    row.put("issue_count", distribution.issueCount());
    row.put("percentage", distribution.percentage());
    return row;
  }

  private Map<String, Object> errorRow(ClassificationError error) {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("issue_id", error.issueId());
    row.put("error_code", error.code().name());
    row.put("message", error.message());
    return row;
  }
}
