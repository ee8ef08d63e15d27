/*
 * どこで: Attendance サービス層
 * 何を: 締め時刻を過ぎた日に、記録を持たないスタッフへ欠勤レコードを作る
 * なぜ: 打刻のない日を「記録なし」ではなく欠勤として確定させるため
 */
package com.example.attendance.service;

import com.example.attendance.config.AttendanceProperties;
import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.repository.AttendanceRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AbsenceSweepService {

  private static final Logger logger = LoggerFactory.getLogger(AbsenceSweepService.class);

  private final AttendanceRepository attendanceRepository;
  private final AttendanceStateMachine stateMachine;
  private final AttendanceMetrics metrics;
  private final AttendanceProperties properties;
  private final Clock clock;
  private final AtomicReference<LocalDate> lastSweptDate = new AtomicReference<>();

  /**
   * 指定日の欠勤スイープを行う。既存レコードには触れないため、何度実行しても結果は同じ。
   * 1 ユーザの書き込み失敗はログに残して次のユーザへ進む。
   */
  public SweepReport sweep(LocalDate workDate) {
    final Instant now = Instant.now(clock);
    final List<String> candidates = attendanceRepository.findUserIdsMissingRecord(workDate);
    int created = 0;
    int skipped = 0;
    int failed = 0;
    for (String userId : candidates) {
      final AttendanceTransition transition =
          stateMachine.decide(AttendanceCommand.absenceSweep(userId, workDate, now), null);
      final AttendanceRecord target = transition.target();
      try {
        if (attendanceRepository.insertIfAbsent(target) > 0) {
          created++;
        } else {
          // 一覧取得後にログイン等でレコードが作られた
          skipped++;
        }
      } catch (DataAccessException ex) {
        failed++;
        logger.error("absence sweep write failed userId={} date={}", userId, workDate, ex);
      }
    }
    metrics.recordSweep(created, failed);
    final SweepReport report = new SweepReport(workDate, candidates.size(), created, skipped, failed);
    logger.info(
        "absence sweep finished date={} candidates={} created={} skipped={} failed={}",
        workDate,
        report.candidates(),
        created,
        skipped,
        failed);
    return report;
  }

  /** 締め時刻を過ぎていなければ SWEEP_TOO_EARLY で拒否する。 */
  public SweepReport sweepIfCutoffPassed(LocalDate workDate) {
    if (!cutoffPassed(workDate)) {
      throw new AttendanceRuleException(
          AttendanceErrorCode.SWEEP_TOO_EARLY,
          "cutoff " + properties.cutoffTime() + " has not passed for " + workDate);
    }
    return sweep(workDate);
  }

  /** 今日の締め時刻を過ぎていて、まだ今日を処理していなければスイープする。 */
  public boolean sweepTodayIfDue() {
    final LocalDate today = LocalDate.now(clock);
    if (today.equals(lastSweptDate.get()) || !cutoffPassed(today)) {
      return false;
    }
    sweep(today);
    lastSweptDate.set(today);
    return true;
  }

  boolean cutoffPassed(LocalDate workDate) {
    final ZonedDateTime cutoff = workDate.atTime(properties.cutoffTime()).atZone(clock.getZone());
    return !Instant.now(clock).isBefore(cutoff.toInstant());
  }
}
