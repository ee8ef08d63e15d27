/*
 * どこで: Attendance アプリの設定バインド
 * 何を: 通知配信ワーカーのポーリング/バッチ/リース設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.attendance.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.delivery")
public record NotificationDeliveryProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    int errorMessageMaxLength,
    Duration lease) {

  public NotificationDeliveryProperties {
    pollInterval = pollInterval == null ? Duration.ofSeconds(2) : pollInterval;
    batchSize = batchSize <= 0 ? 50 : batchSize;
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
    lease = lease == null || lease.isZero() || lease.isNegative() ? Duration.ofSeconds(60) : lease;
  }
}
