/*
 * どこで: 祝日カレンダー層
 * 何を: 祝日 API 呼び出し失敗を表現する
 * なぜ: リトライ可否と縮退運転の判断を理由コードで一貫させるため
 */
package com.issuesla.gold.holiday;

public class HolidayFetchException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public HolidayFetchException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public HolidayFetchException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
