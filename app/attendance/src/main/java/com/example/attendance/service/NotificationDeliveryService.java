/*
 * どこで: Notification サービス層
 * 何を: PENDING 通知を claim し、1 回だけ送信して結果を記録する
 * なぜ: 配信失敗を再送せず終端状態として監査ログに残すため
 */
package com.example.attendance.service;

import com.example.attendance.config.NotificationDeliveryProperties;
import com.example.attendance.model.NotificationRecord;
import com.example.attendance.model.StaffUserRecord;
import com.example.attendance.repository.NotificationRepository;
import com.example.attendance.repository.StaffUserRepository;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  static final String STALE_CLAIM_ERROR = "delivery outcome unknown: claim lease expired";
  static final String MISSING_ADDRESS_ERROR = "contact address not registered";

  private final NotificationRepository notificationRepository;
  private final StaffUserRepository staffUserRepository;
  private final NotificationQueueService queueService;
  private final NotificationSender sender;
  private final NotificationDeliveryProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /** 処理した(SENT/FAILED を記録した)件数を返す。 */
  public int processPendingBatch() {
    final Instant now = Instant.now(clock);
    // 送信中に落ちたワーカーの claim は結果不明のため FAILED で閉じる
    final int stale = notificationRepository.failStaleClaims(now.minus(properties.lease()), STALE_CLAIM_ERROR);
    if (stale > 0) {
      logger.warn("stale notification claims marked failed count={}", stale);
    }
    final String lockedBy = resolveLockedBy();
    final List<NotificationRecord> claimed =
        notificationRepository.claimPending(properties.batchSize(), now, lockedBy);
    int processed = 0;
    for (NotificationRecord record : claimed) {
      try {
        if (deliver(record)) {
          processed++;
        }
      } catch (DataAccessException ex) {
        logger.error(
            "notification result could not be recorded id={} userId={}",
            record.notificationId(),
            record.userId(),
            ex);
      }
    }
    metrics.updateBacklogCurrent(notificationRepository.countPending());
    return processed;
  }

  /** 1 件を送信し結果を記録する。既に終端状態だった場合は false。 */
  @VisibleForTesting
  boolean deliver(NotificationRecord record) {
    final Optional<String> address =
        staffUserRepository
            .findByUserId(record.userId())
            .map(StaffUserRecord::contactAddress)
            .filter(value -> !value.isBlank());
    if (address.isEmpty()) {
      logger.warn(
          "notification skipped; no contact address id={} userId={}",
          record.notificationId(),
          record.userId());
      metrics.recordDeliveryResult("failed");
      return queueService.markFailed(record.notificationId(), MISSING_ADDRESS_ERROR);
    }
    final DeliveryResult result = send(record, address.get());
    if (result.success()) {
      metrics.recordDeliveryResult("sent");
      logger.info(
          "notification sent id={} userId={} type={}",
          record.notificationId(),
          record.userId(),
          record.type());
      return queueService.markSent(record.notificationId(), Instant.now(clock));
    }
    metrics.recordDeliveryResult("failed");
    logger.warn(
        "notification delivery failed id={} userId={} reason={}",
        record.notificationId(),
        record.userId(),
        result.reason());
    return queueService.markFailed(record.notificationId(), result.reason());
  }

  private DeliveryResult send(NotificationRecord record, String address) {
    try {
      return sender.send(address, record.message());
    } catch (RuntimeException ex) {
      logger.warn("notification sender threw id={}", record.notificationId(), ex);
      return DeliveryResult.failure(ex.getMessage());
    }
  }

  @VisibleForTesting
  String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
