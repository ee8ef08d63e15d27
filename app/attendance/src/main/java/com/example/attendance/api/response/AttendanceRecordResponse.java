/*
 * どこで: Attendance API レスポンス DTO
 * 何を: 1 日分の勤怠レコードと勤務時間を返す
 * なぜ: version などの内部項目を API に露出しないため
 */
package com.example.attendance.api.response;

import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.model.AttendanceStatus;
import com.example.attendance.model.WorkType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendanceRecordResponse(
    String userId,
    LocalDate workDate,
    Instant loginTime,
    Instant logoutTime,
    AttendanceStatus status,
    WorkType workType,
    String notes,
    Long workDurationMinutes) {

  public static AttendanceRecordResponse from(AttendanceRecord record) {
    return new AttendanceRecordResponse(
        record.userId(),
        record.workDate(),
        record.loginTime(),
        record.logoutTime(),
        record.status(),
        record.workType(),
        record.notes(),
        record.workDurationMinutes());
  }
}
