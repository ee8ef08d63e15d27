/*
 * どこで: Notification ドメインモデル
 * 何を: 通知の配信状態を表す列挙
 * なぜ: DB と配信処理の状態を一致させるため
 */
package com.example.attendance.model;

public enum NotificationStatus {
  PENDING,
  SENT,
  FAILED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
