/*
 * どこで: Attendance サービス層
 * 何を: 勤怠イベントの拒否理由を定義する
 * なぜ: 呼び出し側が同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.attendance.service;

public enum AttendanceErrorCode {
  DUPLICATE_LOGIN,
  DUPLICATE_LOGOUT,
  INVALID_ORDERING,
  CONFLICTING_RECORD,
  USER_INACTIVE,
  RECORD_NOT_FOUND,
  USER_NOT_FOUND,
  ROLE_NOT_TRACKED,
  PAST_DATE,
  SWEEP_TOO_EARLY
}
