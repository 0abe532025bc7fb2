/*
 * どこで: SLA Gold 設定
 * 何を: 入力エクスポート・出力先・起動時実行・並列度を保持する
 * なぜ: ファイル配置と実行方法をコード外で切り替えるため
 */
package com.issuesla.gold.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "sla.pipeline")
@Validated
public record PipelineProperties(
    @NotNull Path inputPath,
    @NotNull Path outputDir,
    boolean runOnStartup,
    @NotNull @Positive Integer parallelism) {

  public PipelineProperties {
    inputPath = inputPath == null ? Path.of("resources", "jira_issues_raw.json") : inputPath;
    outputDir = outputDir == null ? Path.of("data", "gold") : outputDir;
    parallelism = parallelism == null ? 1 : parallelism;
  }
}
