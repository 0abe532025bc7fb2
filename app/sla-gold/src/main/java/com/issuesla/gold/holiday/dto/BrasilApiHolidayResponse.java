/*
 * どこで: 祝日 API 下流 DTO
 * 何を: BrasilAPI /feriados/v1/{year} の 1 要素を表現する
 * なぜ: 応答 JSON を型で受け、date の欠落を検出するため
 */
package com.issuesla.gold.holiday.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BrasilApiHolidayResponse(String date, String name, String type) {}
