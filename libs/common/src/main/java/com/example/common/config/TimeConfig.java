/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を Bean として提供する
 * なぜ: トークン発行時刻や検証時刻をテストで固定できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
