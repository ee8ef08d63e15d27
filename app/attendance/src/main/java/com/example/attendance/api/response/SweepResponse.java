package com.example.attendance.api.response;

import com.example.attendance.service.SweepReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SweepResponse(LocalDate date, int candidates, int created, int skipped, int failed) {

  public static SweepResponse from(SweepReport report) {
    return new SweepResponse(
        report.workDate(), report.candidates(), report.created(), report.skipped(), report.failed());
  }
}
