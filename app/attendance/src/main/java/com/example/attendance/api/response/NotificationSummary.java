/*
 * どこで: Notification API モデル
 * 何を: 受信箱一覧の要素
 * なぜ: 送信状態と失敗理由を利用者が確認できるようにするため
 */
package com.example.attendance.api.response;

import com.example.attendance.model.NotificationRecord;
import com.example.attendance.model.NotificationStatus;
import com.example.attendance.model.NotificationType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    long notificationId,
    NotificationType type,
    NotificationStatus status,
    String message,
    Instant createdAt,
    Instant sentAt,
    String errorMessage) {

  public static NotificationSummary from(NotificationRecord record) {
    return new NotificationSummary(
        record.notificationId(),
        record.type(),
        record.status(),
        record.message(),
        record.createdAt(),
        record.sentAt(),
        record.errorMessage());
  }
}
