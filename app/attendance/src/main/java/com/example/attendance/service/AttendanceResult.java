package com.example.attendance.service;

import com.example.attendance.model.AttendanceRecord;

public record AttendanceResult(AttendanceRecord record, AttendanceOutcome outcome) {

  public static AttendanceResult applied(AttendanceRecord record) {
    return new AttendanceResult(record, AttendanceOutcome.APPLIED);
  }

  public static AttendanceResult duplicate(AttendanceRecord record, AttendanceErrorCode code) {
    final AttendanceOutcome outcome =
        code == AttendanceErrorCode.DUPLICATE_LOGOUT
            ? AttendanceOutcome.DUPLICATE_LOGOUT
            : AttendanceOutcome.DUPLICATE_LOGIN;
    return new AttendanceResult(record, outcome);
  }
}
