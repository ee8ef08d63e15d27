package com.example.attendance.api.response;

import com.example.attendance.service.AttendanceOutcome;
import com.example.attendance.service.AttendanceResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 重複ログイン/ログアウトも 200 で返し、outcome で区別する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendanceEventResponse(AttendanceOutcome outcome, AttendanceRecordResponse record) {

  public static AttendanceEventResponse from(AttendanceResult result) {
    return new AttendanceEventResponse(
        result.outcome(),
        result.record() == null ? null : AttendanceRecordResponse.from(result.record()));
  }
}
