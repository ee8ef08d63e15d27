/*
 * どこで: Attendance データアクセス
 * 何を: (user_id, work_date) の一意制約違反を表す例外
 * なぜ: 競合に負けた書き込みを呼び出し側で再読込・再適用させるため
 */
package com.example.attendance.repository;

import java.time.LocalDate;

public class AttendanceUniquenessViolationException extends RuntimeException {

  private final String userId;
  private final LocalDate workDate;

  public AttendanceUniquenessViolationException(String userId, LocalDate workDate, Throwable cause) {
    super("attendance record already exists userId=" + userId + " date=" + workDate, cause);
    this.userId = userId;
    this.workDate = workDate;
  }

  public String userId() {
    return userId;
  }

  public LocalDate workDate() {
    return workDate;
  }
}
