/*
 * どこで: SLA Gold アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: sla.* の設定クラスをまとめて有効化するため
 */
package com.issuesla.gold;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SlaGoldApplication {

  public static void main(String[] args) {
    SpringApplication.run(SlaGoldApplication.class, args);
  }
}
