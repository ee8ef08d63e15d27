package com.example.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.model.AttendanceStatus;
import com.example.attendance.model.StaffRole;
import com.example.attendance.model.StaffStatus;
import com.example.attendance.model.StaffUserRecord;
import com.example.attendance.model.WorkType;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class NotificationMessageFormatterTest {

  private static final Instant LOGIN = Instant.parse("2026-03-02T03:35:00Z");
  private static final Instant LOGOUT = Instant.parse("2026-03-02T12:00:00Z");
  private static final StaffUserRecord USER =
      new StaffUserRecord("u-1", "Asha", StaffRole.STAFF, StaffStatus.ACTIVE, "+91-1", null);

  private final NotificationMessageFormatter formatter =
      new NotificationMessageFormatter(Clock.fixed(LOGIN, ZoneId.of("Asia/Kolkata")));

  @Test
  void loginMessageUsesBusinessTimeZone() {
    assertThat(formatter.loginMessage(USER, record()))
        .isEqualTo(
            "Hi Asha,\n\nYou have successfully signed in at 9:05 AM.\n\nHave a productive day!");
  }

  @Test
  void logoutMessageIncludesWorkDuration() {
    assertThat(formatter.logoutMessage(USER, record().withLogout(LOGOUT, LOGOUT)))
        .isEqualTo(
            "Hi Asha,\n\nYou have signed out at 5:30 PM.\n\n"
                + "Today's work duration: 505 minutes (8h 25m).\n\nHave a good evening!");
  }

  private AttendanceRecord record() {
    return AttendanceRecord.create(
        "u-1",
        LocalDate.parse("2026-03-02"),
        LOGIN,
        AttendanceStatus.PRESENT,
        WorkType.OFFICE,
        null,
        LOGIN);
  }
}
