package com.example.attendance.service;

import com.example.attendance.model.AttendanceStatus;
import com.example.attendance.model.StaffUserRecord;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/** 1 日分の集計。unaccounted は出勤/休暇/在宅のいずれの記録もないアクティブなスタッフ。 */
public record DailyAttendanceStats(
    LocalDate workDate,
    int activeStaff,
    Map<AttendanceStatus, Integer> counts,
    List<StaffUserRecord> unaccounted) {

  public DailyAttendanceStats {
    counts = counts == null ? Map.of() : Map.copyOf(counts);
    unaccounted = unaccounted == null ? List.of() : List.copyOf(unaccounted);
  }
}
