/*
 * どこで: Notification 配信ワーカー
 * 何を: 一定間隔で PENDING 通知の配信バッチを起動する
 * なぜ: 勤怠 API の応答を外部チャネルの遅延から切り離すため
 */
package com.example.attendance.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationDeliveryWorker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryWorker.class);

  private final NotificationDeliveryService deliveryService;

  @Scheduled(
      initialDelayString = "${notification.delivery.poll-interval}",
      fixedDelayString = "${notification.delivery.poll-interval}")
  public void dispatchPending() {
    final int processed = deliveryService.processPendingBatch();
    if (processed > 0) {
      logger.debug("notification dispatch cycle finished processed={}", processed);
    }
  }
}
