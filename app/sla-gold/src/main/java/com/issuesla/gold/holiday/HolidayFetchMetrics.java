package com.issuesla.gold.holiday;

/** 祝日取得結果 (success / retry / failure / degraded) の記録先。 */
@FunctionalInterface
public interface HolidayFetchMetrics {

  void recordHolidayFetchResult(String result);
}
