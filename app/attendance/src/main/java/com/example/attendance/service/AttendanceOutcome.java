/*
 * どこで: Attendance サービス層
 * 何を: 受理されたイベントの結果種別
 * なぜ: 重複ログイン/ログアウトを例外ではなく冪等な結果として返すため
 */
package com.example.attendance.service;

public enum AttendanceOutcome {
  APPLIED,
  DUPLICATE_LOGIN,
  DUPLICATE_LOGOUT
}
