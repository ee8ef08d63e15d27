/*
 * どこで: Attendance 管理 API レスポンス DTO
 * 何を: 日次の勤怠集計と未記録スタッフ一覧を返す
 * なぜ: 管理画面が当日の状況を 1 回の呼び出しで把握できるようにするため
 */
package com.example.attendance.api.response;

import com.example.attendance.model.AttendanceStatus;
import com.example.attendance.model.StaffUserRecord;
import com.example.attendance.service.DailyAttendanceStats;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DailyAttendanceResponse(
    LocalDate date,
    int activeStaff,
    int present,
    int remote,
    int leave,
    int absent,
    List<StaffSummary> unaccounted) {

  public DailyAttendanceResponse {
    unaccounted = unaccounted == null ? List.of() : List.copyOf(unaccounted);
  }

  /** absent は未記録と欠勤記録の両方を含む unaccounted の件数。スイープ前でも当日の欠員を表す。 */
  public static DailyAttendanceResponse from(DailyAttendanceStats stats) {
    return new DailyAttendanceResponse(
        stats.workDate(),
        stats.activeStaff(),
        stats.counts().getOrDefault(AttendanceStatus.PRESENT, 0),
        stats.counts().getOrDefault(AttendanceStatus.REMOTE, 0),
        stats.counts().getOrDefault(AttendanceStatus.LEAVE, 0),
        stats.unaccounted().size(),
        stats.unaccounted().stream().map(StaffSummary::from).toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record StaffSummary(String userId, String displayName, String department) {

    static StaffSummary from(StaffUserRecord user) {
      return new StaffSummary(user.userId(), user.displayName(), user.department());
    }
  }
}
