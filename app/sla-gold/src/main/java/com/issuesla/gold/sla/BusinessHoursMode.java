package com.issuesla.gold.sla;

public enum BusinessHoursMode {
  /** 営業日 1 日を 24 時間として数える。 */
  FULL_DAY,
  /** 営業日のうち勤務時間帯 (既定 07:00-18:00) と重なる時間だけを数える。 */
  WORKING_WINDOW
}
