package com.issuesla.gold.holiday;

import java.time.LocalDate;
import java.util.List;

/** 指定年・国コードの祝日一覧を返す外部ソース。 */
@FunctionalInterface
public interface HolidayProvider {

  List<LocalDate> fetch(int year, String countryCode);
}
