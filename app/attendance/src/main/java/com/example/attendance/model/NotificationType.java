/*
 * どこで: Notification ドメインモデル
 * 何を: 通知の種類を表す列挙
 * なぜ: 監査ログ上でログイン/ログアウト通知とその他を区別するため
 */
package com.example.attendance.model;

public enum NotificationType {
  LOGIN,
  LOGOUT,
  REMINDER,
  ALERT
}
