/*
 * どこで: Attendance 管理 API
 * 何を: 欠勤スイープ/勤怠修正/日次集計/リマインダー送信を公開する
 * なぜ: 管理者の運用操作を明示的なエンドポイントに限定するため
 */
package com.example.attendance.api;

import com.example.attendance.api.request.AttendanceCorrectionRequest;
import com.example.attendance.api.request.AttendanceSweepRequest;
import com.example.attendance.api.request.ReminderRequest;
import com.example.attendance.api.response.AttendanceRecordResponse;
import com.example.attendance.api.response.DailyAttendanceResponse;
import com.example.attendance.api.response.ReminderResponse;
import com.example.attendance.api.response.SweepResponse;
import com.example.attendance.model.NotificationStatus;
import com.example.attendance.service.AbsenceSweepService;
import com.example.attendance.service.AttendanceCorrectionService;
import com.example.attendance.service.AttendanceQueryService;
import com.example.attendance.service.ReminderService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class AttendanceAdminController {

  private final AbsenceSweepService absenceSweepService;
  private final AttendanceCorrectionService attendanceCorrectionService;
  private final AttendanceQueryService attendanceQueryService;
  private final ReminderService reminderService;
  private final Clock clock;

  @PostMapping("/attendance/sweeps")
  public ResponseEntity<SweepResponse> sweep(@Valid @RequestBody AttendanceSweepRequest request) {
    return ResponseEntity.ok(
        SweepResponse.from(absenceSweepService.sweepIfCutoffPassed(request.date())));
  }

  @PatchMapping("/attendance/{userId}/{date}")
  public ResponseEntity<AttendanceRecordResponse> correct(
      @PathVariable("userId") String userId,
      @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
      @Valid @RequestBody AttendanceCorrectionRequest request) {
    return ResponseEntity.ok(
        AttendanceRecordResponse.from(
            attendanceCorrectionService.correct(
                userId, date, request.status(), request.workType(), request.notes())));
  }

  @GetMapping("/attendance/daily")
  public ResponseEntity<DailyAttendanceResponse> daily(
      @RequestParam(name = "date", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate date) {
    final LocalDate target = date == null ? LocalDate.now(clock) : date;
    return ResponseEntity.ok(
        DailyAttendanceResponse.from(attendanceQueryService.dailyStats(target)));
  }

  @PostMapping("/notifications/reminders")
  public ResponseEntity<ReminderResponse> remind(@Valid @RequestBody ReminderRequest request) {
    final long id = reminderService.sendReminder(request.userId(), request.message());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new ReminderResponse(id, NotificationStatus.PENDING.name()));
  }
}
