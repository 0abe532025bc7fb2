/*
 * どこで: SLA ルール層
 * 何を: 2 時刻間の営業時間 (土日・祝日を除く) を計算する
 * なぜ: 優先度別 SLA と比較する解決時間をデータ辞書どおりの単位で求めるため
 */
package com.issuesla.gold.sla;

import com.issuesla.common.UtcTimestamps;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Set;

public class BusinessDurationCalculator {

  private static final double HOURS_PER_BUSINESS_DAY = 24.0d;
  private static final double SECONDS_PER_HOUR = 3600.0d;

  private final BusinessHoursMode mode;
  private final LocalTime windowStart;
  private final LocalTime windowEnd;

  public BusinessDurationCalculator() {
    this(BusinessHoursMode.FULL_DAY, LocalTime.of(7, 0), LocalTime.of(18, 0));
  }

  public BusinessDurationCalculator(
      BusinessHoursMode mode, LocalTime windowStart, LocalTime windowEnd) {
    if (mode == null) {
      throw new IllegalArgumentException("mode is required");
    }
    if (windowStart == null || windowEnd == null || !windowStart.isBefore(windowEnd)) {
      throw new IllegalArgumentException("windowStart must be before windowEnd");
    }
    this.mode = mode;
    this.windowStart = windowStart;
    this.windowEnd = windowEnd;
  }

  public BusinessHoursMode mode() {
    return mode;
  }

  public double businessHours(Instant start, Instant end, Set<LocalDate> holidays) {
    return businessHours(null, start, end, holidays);
  }

  /**
   * 役割: start から end までの営業時間を返す。
   * 動作: FULL_DAY では [start, end) と正の長さで重なる営業日ごとに 24 時間を加算する。
   * したがって同一時刻は 0、月曜 00:00 から火曜 00:00 は 24 となる。
   * WORKING_WINDOW では各営業日の勤務時間帯と重なる時間を小数第 2 位まで数える。
   * 前提: 時刻は UTC の暦日で評価する。end が start より前なら InvalidRangeException。
   */
  public double businessHours(
      String issueId, Instant start, Instant end, Set<LocalDate> holidays) {
    if (start == null || end == null) {
      throw new IllegalArgumentException("start and end are required");
    }
    if (end.isBefore(start)) {
      throw new InvalidRangeException(issueId, start, end);
    }
    if (end.equals(start)) {
      return 0.0d;
    }
    final Set<LocalDate> nonWorking = holidays == null ? Set.of() : holidays;
    if (mode == BusinessHoursMode.WORKING_WINDOW) {
      return windowHours(start, end, nonWorking);
    }
    return fullDayHours(start, end, nonWorking);
  }

  public boolean isWorkingDay(LocalDate date, Set<LocalDate> holidays) {
    final DayOfWeek dayOfWeek = date.getDayOfWeek();
    if (dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY) {
      return false;
    }
    return holidays == null || !holidays.contains(date);
  }

  private double fullDayHours(Instant start, Instant end, Set<LocalDate> holidays) {
    final LocalDate first = UtcTimestamps.utcDate(start);
    // end が 0 時ちょうどならその日はまだ経過していない
    final LocalDate last = lastTouchedDate(end);
    long workingDays = 0;
    for (LocalDate date = first; !date.isAfter(last); date = date.plusDays(1)) {
      if (isWorkingDay(date, holidays)) {
        workingDays++;
      }
    }
    return workingDays * HOURS_PER_BUSINESS_DAY;
  }

  private double windowHours(Instant start, Instant end, Set<LocalDate> holidays) {
    final LocalDate first = UtcTimestamps.utcDate(start);
    final LocalDate last = lastTouchedDate(end);
    long seconds = 0;
    for (LocalDate date = first; !date.isAfter(last); date = date.plusDays(1)) {
      if (!isWorkingDay(date, holidays)) {
        continue;
      }
      final Instant dayStart = date.atTime(windowStart).toInstant(ZoneOffset.UTC);
      final Instant dayEnd = date.atTime(windowEnd).toInstant(ZoneOffset.UTC);
      final Instant from = start.isAfter(dayStart) ? start : dayStart;
      final Instant to = end.isBefore(dayEnd) ? end : dayEnd;
      if (to.isAfter(from)) {
        seconds += Duration.between(from, to).getSeconds();
      }
    }
    return BigDecimal.valueOf(seconds / SECONDS_PER_HOUR)
        .setScale(2, RoundingMode.HALF_UP)
        .doubleValue();
  }

  private LocalDate lastTouchedDate(Instant end) {
    final LocalDate endDate = UtcTimestamps.utcDate(end);
    if (end.equals(endDate.atStartOfDay(ZoneOffset.UTC).toInstant())) {
      return endDate.minusDays(1);
    }
    return endDate;
  }
}
