/*
 * どこで: Attendance 欠勤スイープワーカー
 * 何を: スケジュールで当日の欠勤スイープを起動する
 * なぜ: 締め時刻を過ぎた日を人手を介さず確定させるため
 */
package com.example.attendance.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "attendance.sweep.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class AbsenceSweepWorker {

  private final AbsenceSweepService sweepService;

  @Scheduled(fixedDelayString = "${attendance.sweep.poll-interval}")
  public void run() {
    sweepService.sweepTodayIfDue();
  }
}
