package com.example.attendance.service;

import com.example.attendance.model.AttendanceRecord;
import java.time.LocalDate;
import java.util.List;

public record AttendanceHistory(
    String userId, LocalDate from, LocalDate to, List<AttendanceRecord> records,
    AttendanceSummary summary) {

  public AttendanceHistory {
    records = records == null ? List.of() : List.copyOf(records);
  }
}
