package com.example.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.model.AttendanceStatus;
import com.example.attendance.model.WorkType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class AttendanceSummaryTest {

  private static final LocalDate DAY = LocalDate.parse("2026-03-02");
  private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

  @Test
  void remoteLoginDayCountsOnlyAsRemote() {
    final AttendanceSummary summary =
        AttendanceSummary.of(List.of(record(DAY, AttendanceStatus.PRESENT, WorkType.REMOTE)));

    assertThat(summary).isEqualTo(new AttendanceSummary(0, 1, 0, 0, 1));
  }

  @Test
  void categoriesAddUpToTotal() {
    final AttendanceSummary summary =
        AttendanceSummary.of(
            List.of(
                record(DAY, AttendanceStatus.PRESENT, WorkType.REMOTE),
                record(DAY.minusDays(1), AttendanceStatus.PRESENT, WorkType.OFFICE),
                record(DAY.minusDays(2), AttendanceStatus.REMOTE, WorkType.REMOTE),
                record(DAY.minusDays(3), AttendanceStatus.LEAVE, WorkType.LEAVE),
                record(DAY.minusDays(4), AttendanceStatus.ABSENT, WorkType.OFFICE),
                record(DAY.minusDays(5), AttendanceStatus.PRESENT, WorkType.OFFICE)));

    assertThat(summary.present() + summary.remote() + summary.leave() + summary.absent())
        .isEqualTo(summary.total());
    assertThat(summary).isEqualTo(new AttendanceSummary(2, 2, 1, 1, 6));
  }

  @Test
  void emptyWindowIsAllZero() {
    assertThat(AttendanceSummary.of(List.of())).isEqualTo(new AttendanceSummary(0, 0, 0, 0, 0));
  }

  private AttendanceRecord record(LocalDate day, AttendanceStatus status, WorkType workType) {
    return AttendanceRecord.create("u-1", day, null, status, workType, null, NOW);
  }
}
