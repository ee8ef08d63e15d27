/*
 * どこで: Notification サービス層
 * 何を: ログイン/ログアウト通知の本文を組み立てる
 * なぜ: 本文の書式と時刻表示のタイムゾーンを 1 か所に揃えるため
 */
package com.example.attendance.service;

import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.model.StaffUserRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationMessageFormatter {

  private static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("h:mm a", Locale.ENGLISH);

  private final Clock clock;

  public String loginMessage(StaffUserRecord user, AttendanceRecord record) {
    return "Hi " + user.displayName() + ",\n\n"
        + "You have successfully signed in at " + formatTime(record.loginTime()) + ".\n\n"
        + "Have a productive day!";
  }

  public String logoutMessage(StaffUserRecord user, AttendanceRecord record) {
    final StringBuilder message =
        new StringBuilder()
            .append("Hi ")
            .append(user.displayName())
            .append(",\n\nYou have signed out at ")
            .append(formatTime(record.logoutTime()))
            .append('.');
    final Long minutes = record.workDurationMinutes();
    if (minutes != null) {
      message
          .append("\n\nToday's work duration: ")
          .append(minutes)
          .append(" minutes (")
          .append(minutes / 60)
          .append("h ")
          .append(minutes % 60)
          .append("m).");
    }
    return message.append("\n\nHave a good evening!").toString();
  }

  private String formatTime(Instant instant) {
    return TIME_FORMAT.format(instant.atZone(clock.getZone()));
  }
}
