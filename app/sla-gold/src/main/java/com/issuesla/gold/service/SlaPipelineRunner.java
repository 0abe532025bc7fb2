/*
 * どこで: SLA Gold 起動処理
 * 何を: アプリ起動時にパイプラインを 1 回実行する
 * なぜ: スケジューラを持たず、プロセス起動 = 1 実行として外部から呼び出せるようにするため
 */
package com.issuesla.gold.service;

import com.issuesla.gold.model.PipelineRunSummary;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "sla.pipeline.run-on-startup", havingValue = "true")
public class SlaPipelineRunner implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(SlaPipelineRunner.class);

  private final SlaPipelineService pipelineService;

  @Override
  public void run(ApplicationArguments args) {
    final PipelineRunSummary summary = pipelineService.run();
    logger.info("pipeline finished runId={} outputs={}", summary.runId(), summary.outputs().size());
    for (Path output : summary.outputs()) {
      logger.info("- {}", output);
    }
  }
}
