/*
 * どこで: Attendance サービス層
 * 何を: 状態遷移の結果と欠勤スイープの件数を記録する
 * なぜ: 重複ログインや競合の頻度を運用で把握するため
 */
package com.example.attendance.service;

import com.example.attendance.model.AttendanceEventType;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AttendanceMetrics {

  private static final String METRIC_TRANSITION_TOTAL = "attendance.transition.total";
  private static final String METRIC_RACE_ABSORBED_TOTAL = "attendance.race.absorbed.total";
  private static final String METRIC_SWEEP_CREATED_TOTAL = "attendance.sweep.created.total";
  private static final String METRIC_SWEEP_FAILED_TOTAL = "attendance.sweep.failed.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
  private final Counter raceAbsorbedCounter;
  private final Counter sweepCreatedCounter;
  private final Counter sweepFailedCounter;

  public AttendanceMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.raceAbsorbedCounter =
        Counter.builder(METRIC_RACE_ABSORBED_TOTAL)
            .description("Attendance writes that lost a race and were re-applied")
            .register(meterRegistry);
    this.sweepCreatedCounter =
        Counter.builder(METRIC_SWEEP_CREATED_TOTAL)
            .description("Absent records created by the absence sweep")
            .register(meterRegistry);
    this.sweepFailedCounter =
        Counter.builder(METRIC_SWEEP_FAILED_TOTAL)
            .description("Users skipped by the absence sweep because of a write failure")
            .register(meterRegistry);
  }

  public void recordTransition(AttendanceEventType event, String outcome) {
    final String key = event.name() + ":" + outcome;
    transitionCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_TRANSITION_TOTAL)
                    .description("Attendance event outcomes")
                    .tags(Tags.of("event", event.name(), "outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordRaceAbsorbed() {
    raceAbsorbedCounter.increment();
  }

  public void recordSweep(int created, int failed) {
    sweepCreatedCounter.increment(created);
    sweepFailedCounter.increment(failed);
  }
}
