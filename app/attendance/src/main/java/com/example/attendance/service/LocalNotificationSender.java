/*
 * どこで: Notification サービス層
 * 何を: 通知送信を模擬する実装
 * なぜ: 外部チャネル未設定の環境でも状態遷移を確認できるようにするため
 */
package com.example.attendance.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "notification.channel", havingValue = "local", matchIfMissing = true)
public class LocalNotificationSender implements NotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalNotificationSender.class);

  @Override
  public DeliveryResult send(String address, String message) {
    // 実送信は行わず、ログに残すだけとする
    logger.info("notification simulated send address={} length={}", address, message.length());
    return DeliveryResult.ok();
  }
}
