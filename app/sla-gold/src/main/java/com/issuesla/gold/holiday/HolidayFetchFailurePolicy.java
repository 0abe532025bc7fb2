package com.issuesla.gold.holiday;

public enum HolidayFetchFailurePolicy {
  /** 祝日が取れなければ実行を中断する。 */
  ABORT,
  /** 祝日なしとして続行する (縮退運転)。 */
  TREAT_AS_NO_HOLIDAYS
}
