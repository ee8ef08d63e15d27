/*
 * どこで: Attendance ドメインモデル
 * 何を: 既存レコードの打刻状況による分類
 * なぜ: 状態遷移表の行キーとして使うため
 */
package com.example.attendance.model;

public enum RecordState {
  /** レコードなし */
  NONE,
  /** レコードはあるが未ログイン(欠勤/休暇/在宅の事前登録) */
  SCHEDULED,
  /** ログイン済み・未ログアウト */
  OPEN,
  /** ログイン・ログアウトとも記録済み */
  CLOSED;

  public static RecordState of(AttendanceRecord record) {
    if (record == null) {
      return NONE;
    }
    if (record.loginTime() == null) {
      return SCHEDULED;
    }
    return record.logoutTime() == null ? OPEN : CLOSED;
  }
}
