/*
 * どこで: Attendance サービス層
 * 何を: 管理者による勤怠レコードの状態/勤務形態/備考の上書き
 * なぜ: 状態遷移表を経由しない修正を明示的な経路に限定するため
 */
package com.example.attendance.service;

import com.example.attendance.config.AttendanceProperties;
import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.model.AttendanceStatus;
import com.example.attendance.model.WorkType;
import com.example.attendance.repository.AttendanceRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AttendanceCorrectionService {

  private static final Logger logger = LoggerFactory.getLogger(AttendanceCorrectionService.class);

  private final AttendanceRepository attendanceRepository;
  private final AttendanceProperties properties;
  private final Clock clock;

  /**
   * 既存レコードを上書きする。打刻時刻は変更しない。notes が null の場合は既存の備考を残す。
   */
  public AttendanceRecord correct(
      String userId, LocalDate workDate, AttendanceStatus status, WorkType workType, String notes) {
    for (int attempt = 1; attempt <= properties.transitionMaxAttempts(); attempt++) {
      final AttendanceRecord current =
          attendanceRepository
              .find(userId, workDate)
              .orElseThrow(
                  () ->
                      new AttendanceRuleException(
                          AttendanceErrorCode.RECORD_NOT_FOUND,
                          "no attendance record for " + userId + " on " + workDate));
      final AttendanceRecord target =
          current.withDeclaration(
              status == null ? current.status() : status,
              workType == null ? current.workType() : workType,
              notes == null ? current.notes() : notes,
              Instant.now(clock));
      final Optional<AttendanceRecord> updated =
          attendanceRepository.updateIfVersion(target, current.version());
      if (updated.isPresent()) {
        logger.info(
            "attendance corrected userId={} date={} status={}->{} workType={}->{}",
            userId,
            workDate,
            current.status(),
            target.status(),
            current.workType(),
            target.workType());
        return updated.get();
      }
    }
    throw new IllegalStateException(
        "attendance correction did not converge userId=" + userId + " date=" + workDate);
  }
}
