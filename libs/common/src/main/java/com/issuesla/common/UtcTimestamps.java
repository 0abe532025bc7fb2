/*
 * どこで: 共通ユーティリティ
 * 何を: Jira エクスポートの時刻文字列を UTC の Instant に変換し、Gold 出力用に整形する
 * なぜ: Bronze/Gold の両段で同じ解釈と表記 (yyyy-MM-dd'T'HH:mm:ss'Z') を使うため
 */
package com.issuesla.common;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

public final class UtcTimestamps {

  private static final DateTimeFormatter OUTPUT_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

  private static final DateTimeFormatter INPUT_FORMAT =
      new DateTimeFormatterBuilder()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .optionalStart()
          .appendLiteral('T')
          .append(DateTimeFormatter.ISO_LOCAL_TIME)
          .optionalStart()
          .parseLenient()
          .appendOffset("+HH:MM", "Z")
          .parseStrict()
          .optionalEnd()
          .optionalEnd()
          .toFormatter();

  private UtcTimestamps() {}

  // 前提: オフセット付きは UTC に換算し、オフセット無し/日付のみは UTC とみなす
  // 解釈できない値は空を返す (呼び出し側で欠損として扱う)
  public static Optional<Instant> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      final TemporalAccessor parsed =
          INPUT_FORMAT.parseBest(
              value.trim(), OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
      if (parsed instanceof OffsetDateTime) {
        return Optional.of(((OffsetDateTime) parsed).toInstant());
      }
      if (parsed instanceof LocalDateTime) {
        return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
      }
      return Optional.of(((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant());
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }

  public static String format(Instant instant) {
    return instant == null ? null : OUTPUT_FORMAT.format(instant);
  }

  public static LocalDate utcDate(Instant instant) {
    return instant.atOffset(ZoneOffset.UTC).toLocalDate();
  }
}
