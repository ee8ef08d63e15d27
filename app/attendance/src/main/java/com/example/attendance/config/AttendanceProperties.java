/*
 * どこで: Attendance アプリの設定バインド
 * 何を: 締め時刻・欠勤スイープ・状態遷移の再試行設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.attendance.config;

import java.time.Duration;
import java.time.LocalTime;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "attendance")
public record AttendanceProperties(
    LocalTime cutoffTime,
    RemoteLoginPolicy remoteLoginPolicy,
    int transitionMaxAttempts,
    Sweep sweep) {

  public AttendanceProperties {
    cutoffTime = cutoffTime == null ? LocalTime.of(9, 0) : cutoffTime;
    remoteLoginPolicy = remoteLoginPolicy == null ? RemoteLoginPolicy.KEEP_REMOTE : remoteLoginPolicy;
    transitionMaxAttempts = transitionMaxAttempts <= 0 ? 3 : transitionMaxAttempts;
    sweep = sweep == null ? new Sweep(true, Duration.ofMinutes(5)) : sweep;
  }

  public record Sweep(boolean enabled, Duration pollInterval) {}
}
