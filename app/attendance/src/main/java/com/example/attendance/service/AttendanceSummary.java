package com.example.attendance.service;

import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.model.WorkType;
import java.util.List;

/**
 * 期間内の勤怠件数。在宅のままログインした日(PRESENT かつ REMOTE)は remote のみに数え、各日はいずれか 1 区分に入る。
 */
public record AttendanceSummary(int present, int remote, int leave, int absent, int total) {

  public static AttendanceSummary of(List<AttendanceRecord> records) {
    int present = 0;
    int remote = 0;
    int leave = 0;
    int absent = 0;
    for (AttendanceRecord record : records) {
      switch (record.status()) {
        case PRESENT -> {
          if (record.workType() == WorkType.REMOTE) {
            remote++;
          } else {
            present++;
          }
        }
        case REMOTE -> remote++;
        case LEAVE -> leave++;
        case ABSENT -> absent++;
        default -> throw new IllegalStateException("unknown status " + record.status());
      }
    }
    return new AttendanceSummary(present, remote, leave, absent, records.size());
  }
}
