package com.example.attendance.api.response;

import com.example.attendance.service.AttendanceHistory;
import com.example.attendance.service.AttendanceSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendanceHistoryResponse(
    String userId,
    LocalDate from,
    LocalDate to,
    AttendanceSummary summary,
    List<AttendanceRecordResponse> records) {

  public AttendanceHistoryResponse {
    records = records == null ? List.of() : List.copyOf(records);
  }

  public static AttendanceHistoryResponse from(AttendanceHistory history) {
    return new AttendanceHistoryResponse(
        history.userId(),
        history.from(),
        history.to(),
        history.summary(),
        history.records().stream().map(AttendanceRecordResponse::from).toList());
  }
}
