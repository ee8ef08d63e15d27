/*
 * どこで: Attendance ドメインモデル
 * 何を: 勤怠レコードを変化させるイベント種別
 * なぜ: 状態遷移表の列キーとして使うため
 */
package com.example.attendance.model;

public enum AttendanceEventType {
  LOGIN,
  LOGOUT,
  LEAVE_REQUEST,
  REMOTE_MARK,
  ABSENCE_SWEEP
}
