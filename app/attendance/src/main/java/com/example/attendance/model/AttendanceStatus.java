/*
 * どこで: Attendance ドメインモデル
 * 何を: 1 日分の勤怠状態を表す列挙
 * なぜ: DB の CHECK 制約と状態遷移表の状態を一致させるため
 */
package com.example.attendance.model;

public enum AttendanceStatus {
  PRESENT,
  ABSENT,
  LEAVE,
  REMOTE
}
