/*
 * どこで: Attendance サービス層
 * 何を: 勤怠履歴と日次集計の参照
 * なぜ: 個人の直近履歴と管理者向けの当日状況を同じ集計規則で返すため
 */
package com.example.attendance.service;

import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.repository.AttendanceRepository;
import com.example.attendance.repository.StaffUserRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AttendanceQueryService {

  static final int MAX_HISTORY_DAYS = 366;

  private final AttendanceRepository attendanceRepository;
  private final StaffUserRepository staffUserRepository;
  private final Clock clock;

  /** 今日を含む直近 days 日分の記録を新しい順に返す。 */
  public AttendanceHistory history(String userId, int days) {
    if (days < 1 || days > MAX_HISTORY_DAYS) {
      throw new IllegalArgumentException("days must be between 1 and " + MAX_HISTORY_DAYS);
    }
    if (staffUserRepository.findByUserId(userId).isEmpty()) {
      throw new AttendanceRuleException(
          AttendanceErrorCode.USER_NOT_FOUND, "user not found: " + userId);
    }
    final LocalDate to = LocalDate.now(clock);
    final LocalDate from = to.minusDays(days - 1L);
    final List<AttendanceRecord> records = attendanceRepository.findByUserIdBetween(userId, from, to);
    return new AttendanceHistory(userId, from, to, records, AttendanceSummary.of(records));
  }

  public DailyAttendanceStats dailyStats(LocalDate workDate) {
    return new DailyAttendanceStats(
        workDate,
        staffUserRepository.countActiveStaff(),
        attendanceRepository.countByStatus(workDate),
        staffUserRepository.findActiveStaffWithoutAttendance(workDate));
  }
}
