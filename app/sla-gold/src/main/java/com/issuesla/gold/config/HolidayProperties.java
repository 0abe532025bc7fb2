/*
 * どこで: SLA Gold 設定
 * 何を: 祝日 API の接続先・国コード・リトライ・失敗時方針を保持する
 * なぜ: 祝日取得の運用パラメータを外部化し、起動時に妥当性を検証するため
 */
package com.issuesla.gold.config;

import com.issuesla.gold.holiday.HolidayFetchFailurePolicy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "sla.holiday")
@Validated
public record HolidayProperties(
    @NotBlank String baseUrl,
    @NotBlank String holidaysPath,
    @NotBlank String countryCode,
    @NotNull HolidayFetchFailurePolicy onFetchFailure,
    @NotNull @Positive Integer maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout) {

  public HolidayProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://brasilapi.com.br" : baseUrl;
    holidaysPath =
        holidaysPath == null || holidaysPath.isBlank() ? "/api/feriados/v1/{year}" : holidaysPath;
    countryCode = countryCode == null || countryCode.isBlank() ? "BR" : countryCode;
    onFetchFailure = onFetchFailure == null ? HolidayFetchFailurePolicy.ABORT : onFetchFailure;
    maxAttempts = maxAttempts == null ? 3 : maxAttempts;
    backoffBase = backoffBase == null ? Duration.ofMillis(500) : backoffBase;
    backoffMax = backoffMax == null ? Duration.ofSeconds(5) : backoffMax;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  @AssertTrue(message = "sla.holiday.backoff-base must be positive")
  public boolean isBackoffBasePositive() {
    return isPositiveDuration(backoffBase);
  }

  @AssertTrue(message = "sla.holiday.backoff-max must not be shorter than backoff-base")
  public boolean isBackoffMaxNotShorterThanBase() {
    // null は @NotNull で検出する前提。
    return backoffBase == null || backoffMax == null || backoffMax.compareTo(backoffBase) >= 0;
  }

  @AssertTrue(message = "sla.holiday.read-timeout must be positive")
  public boolean isReadTimeoutPositive() {
    return isPositiveDuration(readTimeout);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
