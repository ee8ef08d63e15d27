/*
 * どこで: Attendance アプリの設定バインド
 * 何を: 外部メッセージ配信チャネル(HTTP)の接続先とタイムアウトを保持する
 * なぜ: 配信先とタイムアウトを環境ごとに切り替えるため
 */
package com.example.attendance.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.webhook")
public record NotificationWebhookProperties(
    String baseUrl, String sendPath, Duration connectTimeout, Duration readTimeout) {

  public NotificationWebhookProperties {
    baseUrl = baseUrl == null ? "http://localhost:8089" : baseUrl;
    sendPath = sendPath == null || sendPath.isBlank() ? "/messages" : sendPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
