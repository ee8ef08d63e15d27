/*
 * どこで: Attendance ドメインモデル
 * 何を: attendance_records テーブルのスナップショット
 * なぜ: 状態遷移・API 応答・通知文面の生成で共通化するため
 */
package com.example.attendance.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

public record AttendanceRecord(
    String userId,
    LocalDate workDate,
    Instant loginTime,
    Instant logoutTime,
    AttendanceStatus status,
    WorkType workType,
    String notes,
    long version,
    Instant createdAt,
    Instant updatedAt) {

  public static AttendanceRecord create(
      String userId,
      LocalDate workDate,
      Instant loginTime,
      AttendanceStatus status,
      WorkType workType,
      String notes,
      Instant now) {
    return new AttendanceRecord(
        userId, workDate, loginTime, null, status, workType, notes, 0L, now, now);
  }

  /**
   * ログインからログアウトまでの分数。どちらかが未記録、または順序が逆転している場合は null。
   */
  public Long workDurationMinutes() {
    if (loginTime == null || logoutTime == null || logoutTime.isBefore(loginTime)) {
      return null;
    }
    return Duration.between(loginTime, logoutTime).toMinutes();
  }

  public AttendanceRecord withLogin(
      Instant login, AttendanceStatus nextStatus, WorkType nextWorkType, Instant now) {
    return new AttendanceRecord(
        userId, workDate, login, logoutTime, nextStatus, nextWorkType, notes, version, createdAt, now);
  }

  public AttendanceRecord withLogout(Instant logout, Instant now) {
    return new AttendanceRecord(
        userId, workDate, loginTime, logout, status, workType, notes, version, createdAt, now);
  }

  public AttendanceRecord withDeclaration(
      AttendanceStatus nextStatus, WorkType nextWorkType, String nextNotes, Instant now) {
    return new AttendanceRecord(
        userId, workDate, loginTime, logoutTime, nextStatus, nextWorkType, nextNotes, version,
        createdAt, now);
  }
}
