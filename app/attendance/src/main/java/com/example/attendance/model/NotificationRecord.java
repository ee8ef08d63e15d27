/*
 * どこで: Notification ドメインモデル
 * 何を: notifications テーブルのスナップショット
 * なぜ: 配信処理と受信箱 API で共通化するため
 */
package com.example.attendance.model;

import java.time.Instant;

public record NotificationRecord(
    long notificationId,
    String userId,
    String message,
    NotificationType type,
    NotificationStatus status,
    Instant sentAt,
    String errorMessage,
    String lockedBy,
    Instant lockedAt,
    Instant createdAt) {}
