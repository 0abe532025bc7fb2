package com.issuesla.gold.config;

import com.issuesla.gold.sla.BusinessHoursMode;
import jakarta.validation.constraints.AssertTrue;
import java.time.LocalTime;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "sla.business-hours")
@Validated
public record BusinessHoursProperties(
    BusinessHoursMode mode,
    @DateTimeFormat(pattern = "HH:mm") LocalTime windowStart,
    @DateTimeFormat(pattern = "HH:mm") LocalTime windowEnd) {

  public BusinessHoursProperties {
    mode = mode == null ? BusinessHoursMode.FULL_DAY : mode;
    windowStart = windowStart == null ? LocalTime.of(7, 0) : windowStart;
    windowEnd = windowEnd == null ? LocalTime.of(18, 0) : windowEnd;
  }

  @AssertTrue(message = "sla.business-hours.window-start must be before window-end")
  public boolean isWindowOrdered() {
    return windowStart.isBefore(windowEnd);
  }
}
