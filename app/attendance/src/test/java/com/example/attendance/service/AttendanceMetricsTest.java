/*
 * どこで: Attendance/Notification メトリクステスト
 * 何を: 遷移結果・スイープ・配信結果のメトリクスが記録されることを検証する
 * なぜ: 運用指標の計測回帰を防ぐため
 */
package com.example.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.attendance.model.AttendanceEventType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class AttendanceMetricsTest {

  @Test
  void recordsTransitionAndSweepMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final AttendanceMetrics metrics = new AttendanceMetrics(registry);

    metrics.recordTransition(AttendanceEventType.LOGIN, "APPLIED");
    metrics.recordTransition(AttendanceEventType.LOGIN, "APPLIED");
    metrics.recordTransition(AttendanceEventType.LOGIN, "DUPLICATE_LOGIN");
    metrics.recordRaceAbsorbed();
    metrics.recordSweep(4, 1);

    assertThat(
            registry
                .get("attendance.transition.total")
                .tag("event", "LOGIN")
                .tag("outcome", "APPLIED")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("attendance.transition.total")
                .tag("outcome", "DUPLICATE_LOGIN")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("attendance.race.absorbed.total").counter().count()).isEqualTo(1.0d);
    assertThat(registry.get("attendance.sweep.created.total").counter().count()).isEqualTo(4.0d);
    assertThat(registry.get("attendance.sweep.failed.total").counter().count()).isEqualTo(1.0d);
  }

  @Test
  void recordsDeliveryAndBacklogMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final NotificationMetrics metrics = new NotificationMetrics(registry);

    metrics.recordDeliveryResult("sent");
    metrics.recordDeliveryResult("failed");
    metrics.recordEnqueueFailed();
    metrics.updateBacklogCurrent(3);

    assertThat(registry.get("notification.delivery.total").tag("result", "sent").counter().count())
        .isEqualTo(1.0d);
    assertThat(
            registry.get("notification.delivery.total").tag("result", "failed").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("notification.enqueue.failed.total").counter().count()).isEqualTo(1.0d);
    assertThat(registry.get("notification.backlog.current").gauge().value()).isEqualTo(3.0d);
  }
}
