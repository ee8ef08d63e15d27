/*
 * どこで: Common 共通設定
 * 何を: 業務タイムゾーン付きの Clock を DI 可能にする
 * なぜ: 勤怠日の判定と締め時刻の比較を同じ暦で行い、テストで時刻を固定できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${app.time-zone:UTC}") String timeZone) {
    return Clock.system(ZoneId.of(timeZone));
  }
}
