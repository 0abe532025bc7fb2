/*
 * どこで: SLA Gold 設定
 * 何を: 祝日 API 呼び出し専用 RestClient を提供する
 * なぜ: baseUrl とタイムアウトを下流ごとに分離するため
 */
package com.issuesla.gold.config;

import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class HolidayClientConfig {

  @Bean
  RestClient holidayRestClient(RestClient.Builder builder, HolidayProperties properties) {
    final ClientHttpRequestFactorySettings settings =
        ClientHttpRequestFactorySettings.DEFAULTS
            .withConnectTimeout(properties.connectTimeout())
            .withReadTimeout(properties.readTimeout());
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(ClientHttpRequestFactories.get(settings))
        .build();
  }
}
