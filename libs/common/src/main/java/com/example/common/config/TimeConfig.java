/*
 * どこで: Common 共通設定
 * 何を: UTC 固定の Clock を Bean として公開する
 * なぜ: lease 期限/バックオフ時刻/stale 判定を同じ時刻源で計算し、テストで差し替えられるようにするため
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
