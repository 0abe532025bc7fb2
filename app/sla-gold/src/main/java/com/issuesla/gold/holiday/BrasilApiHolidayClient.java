package com.issuesla.gold.holiday;

import com.issuesla.gold.config.HolidayProperties;
import com.issuesla.gold.holiday.dto.BrasilApiHolidayResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class BrasilApiHolidayClient implements HolidayProvider {

  private static final Logger logger = LoggerFactory.getLogger(BrasilApiHolidayClient.class);
  private static final int MIN_YEAR = 1900;
  private static final int MAX_YEAR = 2199;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient holidayRestClient;

  private final HolidayProperties properties;

  public BrasilApiHolidayClient(RestClient holidayRestClient, HolidayProperties properties) {
    this.holidayRestClient = holidayRestClient;
    this.properties = properties;
  }

  @Override
  public List<LocalDate> fetch(int year, String countryCode) {
    validateYear(year);
    validateCountryCode(countryCode);
    try {
      return toDates(
          year,
          holidayRestClient
              .get()
              .uri(properties.holidaysPath(), year)
              .retrieve()
              .body(BrasilApiHolidayResponse[].class));
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, year);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, year);
    } catch (HolidayFetchException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("holiday fetch response parse failed year={}", year, ex);
      throw new HolidayFetchException(
          HolidayFetchException.Reason.INVALID_RESPONSE, "holiday response parse failed", ex);
    }
  }

  private List<LocalDate> toDates(int year, BrasilApiHolidayResponse[] response) {
    if (response == null) {
      throw new HolidayFetchException(
          HolidayFetchException.Reason.INVALID_RESPONSE, "holiday response is empty");
    }
    final List<LocalDate> dates = new ArrayList<>(response.length);
    for (BrasilApiHolidayResponse holiday : response) {
      if (holiday == null || isBlank(holiday.date())) {
        throw new HolidayFetchException(
            HolidayFetchException.Reason.INVALID_RESPONSE, "holiday date is missing");
      }
      try {
        dates.add(LocalDate.parse(holiday.date()));
      } catch (DateTimeParseException ex) {
        throw new HolidayFetchException(
            HolidayFetchException.Reason.INVALID_RESPONSE,
            "holiday date is malformed: " + holiday.date(),
            ex);
      }
    }
    logger.info("holidays fetched year={} count={}", year, dates.size());
    return dates;
  }

  private HolidayFetchException mapResponseException(RestClientResponseException ex, int year) {
    logger.warn(
        "holiday fetch failed year={} with http status={} statusText={}",
        year,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().is5xxServerError()) {
      return new HolidayFetchException(
          HolidayFetchException.Reason.BAD_GATEWAY, "holiday provider server error", ex);
    }
    if (ex.getStatusCode().value() == 404) {
      return new HolidayFetchException(
          HolidayFetchException.Reason.INVALID_RESPONSE, "holiday year not available", ex);
    }
    return new HolidayFetchException(
        HolidayFetchException.Reason.BAD_GATEWAY, "holiday request failed", ex);
  }

  private HolidayFetchException mapResourceException(ResourceAccessException ex, int year) {
    if (isTimeout(ex)) {
      logger.warn("holiday fetch timed out year={}", year);
      return new HolidayFetchException(
          HolidayFetchException.Reason.TIMEOUT, "holiday request timeout", ex);
    }
    logger.warn("holiday fetch connection failed year={}", year, ex);
    return new HolidayFetchException(
        HolidayFetchException.Reason.BAD_GATEWAY, "holiday provider connection failed", ex);
  }

  // 年はレコード由来の値なので、範囲外は取得失敗として扱い on-fetch-failure に委ねる
  private void validateYear(int year) {
    if (year < MIN_YEAR || year > MAX_YEAR) {
      logger.warn("holiday year not supported year={}", year);
      throw new HolidayFetchException(
          HolidayFetchException.Reason.INVALID_RESPONSE, "holiday year not supported: " + year);
    }
  }

  private void validateCountryCode(String countryCode) {
    if (isBlank(countryCode)) {
      throw new IllegalArgumentException("countryCode is required");
    }
    // BrasilAPI は国別ではなくブラジル固定
    if (!"BR".equalsIgnoreCase(countryCode.trim())) {
      throw new IllegalArgumentException("unsupported countryCode: " + countryCode);
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
