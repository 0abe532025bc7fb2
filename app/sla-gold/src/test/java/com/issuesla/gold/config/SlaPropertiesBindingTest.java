/*
 * どこで: SLA Gold 設定バインドのテスト
 * 何を: sla.* の Duration・LocalTime・enum・Path のバインドと起動時検証を検証する
 * なぜ: 設定表記の変更で閾値や祝日取得方針が黙って既定値に戻る回帰を防ぐため
 */
package com.issuesla.gold.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.issuesla.gold.holiday.HolidayFetchFailurePolicy;
import com.issuesla.gold.sla.BusinessHoursMode;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class SlaPropertiesBindingTest {

  // 設定クラスだけを有効化する最小構成
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void contextStartsAndBindsAllFields() {
    contextRunner
        .withPropertyValues(
            "sla.thresholds.high=8",
            "sla.thresholds.medium=40",
            "sla.thresholds.low=80",
            "sla.holiday.base-url=http://holidays.internal",
            "sla.holiday.on-fetch-failure=treat-as-no-holidays",
            "sla.holiday.max-attempts=5",
            "sla.holiday.backoff-base=200ms",
            "sla.holiday.backoff-max=3s",
            "sla.holiday.read-timeout=4s",
            "sla.business-hours.mode=working-window",
            "sla.business-hours.window-start=08:30",
            "sla.business-hours.window-end=17:00",
            "sla.pipeline.input-path=/data/bronze/export.json",
            "sla.pipeline.output-dir=/data/gold",
            "sla.pipeline.run-on-startup=true",
            "sla.pipeline.parallelism=8")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final SlaThresholdProperties thresholds =
                  context.getBean(SlaThresholdProperties.class);
              final HolidayProperties holiday = context.getBean(HolidayProperties.class);
              final BusinessHoursProperties businessHours =
                  context.getBean(BusinessHoursProperties.class);
              final PipelineProperties pipeline = context.getBean(PipelineProperties.class);

              assertThat(thresholds.high()).isEqualTo(8.0d);
              assertThat(thresholds.low()).isEqualTo(80.0d);
              assertThat(holiday.baseUrl()).isEqualTo("http://holidays.internal");
              assertThat(holiday.onFetchFailure())
                  .isEqualTo(HolidayFetchFailurePolicy.TREAT_AS_NO_HOLIDAYS);
              assertThat(holiday.maxAttempts()).isEqualTo(5);
              assertThat(holiday.backoffBase()).isEqualTo(Duration.ofMillis(200));
              assertThat(holiday.backoffMax()).isEqualTo(Duration.ofSeconds(3));
              assertThat(holiday.readTimeout()).isEqualTo(Duration.ofSeconds(4));
              assertThat(holiday.connectTimeout()).isEqualTo(Duration.ofSeconds(3));
              assertThat(businessHours.mode()).isEqualTo(BusinessHoursMode.WORKING_WINDOW);
              assertThat(businessHours.windowStart()).isEqualTo(LocalTime.of(8, 30));
              assertThat(businessHours.windowEnd()).isEqualTo(LocalTime.of(17, 0));
              assertThat(pipeline.inputPath()).isEqualTo(Path.of("/data/bronze/export.json"));
              assertThat(pipeline.runOnStartup()).isTrue();
              assertThat(pipeline.parallelism()).isEqualTo(8);
            });
  }

  @Test
  void defaultsApplyWhenNothingIsConfigured() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final SlaThresholdProperties thresholds = context.getBean(SlaThresholdProperties.class);
          final HolidayProperties holiday = context.getBean(HolidayProperties.class);

          assertThat(thresholds.high()).isEqualTo(24.0d);
          assertThat(thresholds.medium()).isEqualTo(72.0d);
          assertThat(thresholds.low()).isEqualTo(120.0d);
          assertThat(holiday.baseUrl()).isEqualTo("https://brasilapi.com.br");
          assertThat(holiday.onFetchFailure()).isEqualTo(HolidayFetchFailurePolicy.ABORT);
          assertThat(context.getBean(BusinessHoursProperties.class).mode())
              .isEqualTo(BusinessHoursMode.FULL_DAY);
        });
  }

  @Test
  void contextFailsWhenThresholdsAreNotOrdered() {
    contextRunner
        .withPropertyValues("sla.thresholds.high=80", "sla.thresholds.medium=40")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    SlaThresholdProperties.class,
    HolidayProperties.class,
    BusinessHoursProperties.class,
    PipelineProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
