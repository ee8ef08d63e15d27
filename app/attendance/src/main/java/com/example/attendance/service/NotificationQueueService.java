/*
 * どこで: Notification サービス層
 * 何を: 通知キュー(notifications テーブル)への登録と終端状態の記録を行う
 * なぜ: 通知の登録失敗が勤怠の確定を巻き戻さないよう、失敗をここで閉じ込めるため
 */
package com.example.attendance.service;

import com.example.attendance.config.NotificationDeliveryProperties;
import com.example.attendance.model.NotificationRecord;
import com.example.attendance.model.NotificationType;
import com.example.attendance.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationQueueService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationQueueService.class);

  private final NotificationRepository notificationRepository;
  private final NotificationDeliveryProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /**
   * PENDING の通知を登録して ID を返す。登録に失敗しても例外は投げず、ログに残して空を返す。
   * 呼び出し元の勤怠更新は既に確定しているため、ここで失敗を伝播させない。
   */
  public Optional<Long> enqueue(String userId, String message, NotificationType type) {
    try {
      final long id = notificationRepository.insertPending(userId, message, type, Instant.now(clock));
      logger.info("notification enqueued id={} userId={} type={}", id, userId, type);
      return Optional.of(id);
    } catch (RuntimeException ex) {
      metrics.recordEnqueueFailed();
      logger.error(
          "notification enqueue failed; attendance change is kept userId={} type={}",
          userId,
          type,
          ex);
      return Optional.empty();
    }
  }

  /** 登録失敗をそのまま呼び出し元へ返す。勤怠更新を伴わない通知で使う。 */
  public long enqueueStrict(String userId, String message, NotificationType type) {
    final long id = notificationRepository.insertPending(userId, message, type, Instant.now(clock));
    logger.info("notification enqueued id={} userId={} type={}", id, userId, type);
    return id;
  }

  /** 既に終端状態なら何もしない。状態を変えた場合のみ true。 */
  public boolean markSent(long notificationId, Instant sentAt) {
    final int updated = notificationRepository.markSent(notificationId, sentAt);
    if (updated == 0) {
      logger.debug("notification already terminal; markSent ignored id={}", notificationId);
    }
    return updated > 0;
  }

  /** 既に終端状態なら何もしない。状態を変えた場合のみ true。 */
  public boolean markFailed(long notificationId, String errorMessage) {
    final int updated = notificationRepository.markFailed(notificationId, truncate(errorMessage));
    if (updated == 0) {
      logger.debug("notification already terminal; markFailed ignored id={}", notificationId);
    }
    return updated > 0;
  }

  public List<NotificationRecord> inbox(String userId) {
    return notificationRepository.findByUserId(userId);
  }

  String truncate(String message) {
    if (message == null || message.isBlank()) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (maxLength <= 0 || message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
