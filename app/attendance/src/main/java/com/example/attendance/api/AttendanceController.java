/*
 * どこで: Attendance API
 * 何を: ログイン/ログアウト/休暇/在宅の受付と勤怠履歴の参照を公開する
 * なぜ: 認証基盤からのイベントと利用者の操作を受け付ける入口を提供するため
 */
package com.example.attendance.api;

import com.example.attendance.api.request.AttendanceDeclarationRequest;
import com.example.attendance.api.request.AttendanceEventRequest;
import com.example.attendance.api.response.AttendanceEventResponse;
import com.example.attendance.api.response.AttendanceHistoryResponse;
import com.example.attendance.service.AttendanceQueryService;
import com.example.attendance.service.AttendanceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class AttendanceController {

  private final AttendanceService attendanceService;
  private final AttendanceQueryService attendanceQueryService;

  @PostMapping("/attendance/logins")
  public ResponseEntity<AttendanceEventResponse> login(
      @Valid @RequestBody AttendanceEventRequest request) {
    return ResponseEntity.ok(AttendanceEventResponse.from(attendanceService.login(request.userId())));
  }

  @PostMapping("/attendance/logouts")
  public ResponseEntity<AttendanceEventResponse> logout(
      @Valid @RequestBody AttendanceEventRequest request) {
    return ResponseEntity.ok(
        AttendanceEventResponse.from(attendanceService.logout(request.userId())));
  }

  @PostMapping("/attendance/leaves")
  public ResponseEntity<AttendanceEventResponse> requestLeave(
      @Valid @RequestBody AttendanceDeclarationRequest request) {
    return ResponseEntity.ok(
        AttendanceEventResponse.from(
            attendanceService.requestLeave(request.userId(), request.date(), request.notes())));
  }

  @PostMapping("/attendance/remotes")
  public ResponseEntity<AttendanceEventResponse> markRemote(
      @Valid @RequestBody AttendanceDeclarationRequest request) {
    return ResponseEntity.ok(
        AttendanceEventResponse.from(
            attendanceService.markRemote(request.userId(), request.date(), request.notes())));
  }

  @GetMapping("/users/{userId}/attendance")
  public ResponseEntity<AttendanceHistoryResponse> history(
      @PathVariable("userId") String userId,
      @RequestParam(name = "days", defaultValue = "30") int days) {
    return ResponseEntity.ok(
        AttendanceHistoryResponse.from(attendanceQueryService.history(userId, days)));
  }
}
