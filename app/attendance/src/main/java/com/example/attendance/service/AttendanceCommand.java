/*
 * どこで: Attendance サービス層
 * 何を: 状態遷移表へ入力する 1 件の勤怠イベント
 * なぜ: イベント種別ごとの入力(時刻・対象日・備考)を一つの型で扱うため
 */
package com.example.attendance.service;

import com.example.attendance.model.AttendanceEventType;
import java.time.Instant;
import java.time.LocalDate;

public record AttendanceCommand(
    AttendanceEventType type,
    String userId,
    LocalDate workDate,
    Instant occurredAt,
    String notes) {

  public static AttendanceCommand login(String userId, LocalDate workDate, Instant occurredAt) {
    return new AttendanceCommand(AttendanceEventType.LOGIN, userId, workDate, occurredAt, null);
  }

  public static AttendanceCommand logout(String userId, LocalDate workDate, Instant occurredAt) {
    return new AttendanceCommand(AttendanceEventType.LOGOUT, userId, workDate, occurredAt, null);
  }

  public static AttendanceCommand leaveRequest(
      String userId, LocalDate workDate, Instant occurredAt, String notes) {
    return new AttendanceCommand(
        AttendanceEventType.LEAVE_REQUEST, userId, workDate, occurredAt, notes);
  }

  public static AttendanceCommand remoteMark(
      String userId, LocalDate workDate, Instant occurredAt, String notes) {
    return new AttendanceCommand(
        AttendanceEventType.REMOTE_MARK, userId, workDate, occurredAt, notes);
  }

  public static AttendanceCommand absenceSweep(String userId, LocalDate workDate, Instant occurredAt) {
    return new AttendanceCommand(
        AttendanceEventType.ABSENCE_SWEEP, userId, workDate, occurredAt, null);
  }
}
