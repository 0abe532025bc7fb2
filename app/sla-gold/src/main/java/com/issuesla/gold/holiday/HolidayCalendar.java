/*
 * どこで: 祝日カレンダー層
 * 何を: (年, 地域) ごとの祝日集合を取得・キャッシュする
 * なぜ: 同じ年の祝日 API 呼び出しを 1 実行で 1 回に抑え、並列分類でも重複取得しないため
 */
package com.issuesla.gold.holiday;

import com.google.common.annotations.VisibleForTesting;
import com.issuesla.gold.config.HolidayProperties;
import java.time.Duration;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HolidayCalendar {

  private static final Logger logger = LoggerFactory.getLogger(HolidayCalendar.class);

  private final HolidayProvider provider;
  private final HolidayProperties properties;
  private final HolidayFetchMetrics metrics;
  private final ConcurrentMap<HolidayKey, CompletableFuture<Set<LocalDate>>> cache =
      new ConcurrentHashMap<>();

  public HolidayCalendar(
      HolidayProvider provider, HolidayProperties properties, HolidayFetchMetrics metrics) {
    this.provider = provider;
    this.properties = properties;
    this.metrics = metrics;
  }

  public Set<LocalDate> holidays(int year) {
    return holidays(year, properties.countryCode());
  }

  /**
   * 役割: 指定年・地域の祝日集合を返す。
   * 動作: 初回呼び出しだけがプロバイダを呼び、同時に来た他の呼び出しはその結果を待って共有する。
   * 取得に失敗した場合は on-fetch-failure に従い、ABORT なら HolidayFetchException を送出し、
   * TREAT_AS_NO_HOLIDAYS なら空集合を確定させる。失敗結果もキャッシュし、再取得はしない。
   */
  public Set<LocalDate> holidays(int year, String region) {
    final HolidayKey key = new HolidayKey(year, normalizeRegion(region));
    CompletableFuture<Set<LocalDate>> entry = cache.get(key);
    if (entry == null) {
      final CompletableFuture<Set<LocalDate>> created = new CompletableFuture<>();
      entry = cache.putIfAbsent(key, created);
      if (entry == null) {
        load(key, created);
        entry = created;
      }
    }
    return await(entry);
  }

  public Set<LocalDate> holidaysBetween(int startYear, int endYear) {
    return holidaysBetween(startYear, endYear, properties.countryCode());
  }

  public Set<LocalDate> holidaysBetween(int startYear, int endYear, String region) {
    if (endYear < startYear) {
      throw new IllegalArgumentException("endYear must not be before startYear");
    }
    if (startYear == endYear) {
      return holidays(startYear, region);
    }
    final Set<LocalDate> union = new HashSet<>();
    for (int year = startYear; year <= endYear; year++) {
      union.addAll(holidays(year, region));
    }
    return Set.copyOf(union);
  }

  @VisibleForTesting
  int cachedEntryCount() {
    return cache.size();
  }

  private void load(HolidayKey key, CompletableFuture<Set<LocalDate>> target) {
    try {
      target.complete(Set.copyOf(fetchWithRetry(key)));
    } catch (HolidayFetchException ex) {
      if (properties.onFetchFailure() == HolidayFetchFailurePolicy.TREAT_AS_NO_HOLIDAYS) {
        logger.warn(
            "holiday fetch failed; continuing without holidays year={} region={} reason={}",
            key.year(),
            key.region(),
            ex.reason(),
            ex);
        metrics.recordHolidayFetchResult("degraded");
        target.complete(Set.of());
        return;
      }
      metrics.recordHolidayFetchResult("failure");
      target.completeExceptionally(ex);
    } catch (RuntimeException ex) {
      metrics.recordHolidayFetchResult("failure");
      target.completeExceptionally(ex);
    }
  }

  private List<LocalDate> fetchWithRetry(HolidayKey key) {
    final int maxAttempts = Math.max(1, properties.maxAttempts());
    int attempt = 1;
    while (true) {
      try {
        final List<LocalDate> dates = provider.fetch(key.year(), key.region());
        if (dates == null) {
          throw new HolidayFetchException(
              HolidayFetchException.Reason.INVALID_RESPONSE, "holiday provider returned null");
        }
        metrics.recordHolidayFetchResult("success");
        return dates;
      } catch (HolidayFetchException ex) {
        // 応答形式の不正は再試行しても変わらない
        if (ex.reason() == HolidayFetchException.Reason.INVALID_RESPONSE
            || attempt >= maxAttempts) {
          throw ex;
        }
        final Duration backoff = computeBackoffDuration(attempt);
        logger.warn(
            "holiday fetch retry scheduled year={} region={} attempt={} backoffMs={}",
            key.year(),
            key.region(),
            attempt,
            backoff.toMillis());
        metrics.recordHolidayFetchResult("retry");
        sleep(backoff);
        attempt++;
      }
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(2.0d, attempt - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitter = 0.5d + ThreadLocalRandom.current().nextDouble();
    return Duration.ofMillis((long) Math.ceil(capped * jitter));
  }

  private void sleep(Duration backoff) {
    try {
      Thread.sleep(backoff.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new HolidayFetchException(
          HolidayFetchException.Reason.TIMEOUT, "holiday fetch retry interrupted", ex);
    }
  }

  private Set<LocalDate> await(CompletableFuture<Set<LocalDate>> entry) {
    try {
      return entry.join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof RuntimeException) {
        throw (RuntimeException) ex.getCause();
      }
      throw ex;
    }
  }

  private String normalizeRegion(String region) {
    if (region == null || region.isBlank()) {
      throw new IllegalArgumentException("region is required");
    }
    return region.trim().toUpperCase(Locale.ROOT);
  }

  private record HolidayKey(int year, String region) {}
}
