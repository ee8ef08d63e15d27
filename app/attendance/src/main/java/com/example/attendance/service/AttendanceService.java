/*
 * どこで: Attendance サービス層
 * 何を: ログイン/ログアウト/休暇/在宅イベントを勤怠レコードへ反映し、通知を積む
 * なぜ: 状態遷移表の判定を DB 制約と楽観ロックの上で安全に適用するため
 */
package com.example.attendance.service;

import com.example.attendance.config.AttendanceProperties;
import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.model.NotificationType;
import com.example.attendance.model.StaffUserRecord;
import com.example.attendance.repository.AttendanceRepository;
import com.example.attendance.repository.AttendanceUniquenessViolationException;
import com.example.attendance.repository.StaffUserRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 各書き込みは単一行の auto-commit で確定させる。通知の登録は勤怠の確定後に別文で行い、
 * 登録に失敗しても勤怠の変更は残る。
 */
@Service
@RequiredArgsConstructor
public class AttendanceService {

  private static final Logger logger = LoggerFactory.getLogger(AttendanceService.class);

  private final AttendanceRepository attendanceRepository;
  private final StaffUserRepository staffUserRepository;
  private final AttendanceStateMachine stateMachine;
  private final NotificationQueueService notificationQueueService;
  private final NotificationMessageFormatter messageFormatter;
  private final AttendanceMetrics metrics;
  private final AttendanceProperties properties;
  private final Clock clock;

  public AttendanceResult login(String userId) {
    return login(userId, Instant.now(clock));
  }

  public AttendanceResult login(String userId, Instant occurredAt) {
    final StaffUserRecord user = resolveTrackedUser(userId);
    final AttendanceCommand command =
        AttendanceCommand.login(userId, workDateOf(occurredAt), occurredAt);
    return applyAndNotify(user, command);
  }

  public AttendanceResult logout(String userId) {
    return logout(userId, Instant.now(clock));
  }

  public AttendanceResult logout(String userId, Instant occurredAt) {
    final StaffUserRecord user = resolveTrackedUser(userId);
    final AttendanceCommand command =
        AttendanceCommand.logout(userId, workDateOf(occurredAt), occurredAt);
    return applyAndNotify(user, command);
  }

  public AttendanceResult requestLeave(String userId, LocalDate workDate, String notes) {
    final StaffUserRecord user = resolveTrackedUser(userId);
    final Instant now = Instant.now(clock);
    rejectPastDate(workDate, now);
    return applyAndNotify(user, AttendanceCommand.leaveRequest(userId, workDate, now, notes));
  }

  public AttendanceResult markRemote(String userId, LocalDate workDate, String notes) {
    final StaffUserRecord user = resolveTrackedUser(userId);
    final Instant now = Instant.now(clock);
    rejectPastDate(workDate, now);
    return applyAndNotify(user, AttendanceCommand.remoteMark(userId, workDate, now, notes));
  }

  /** 在籍/ロールの確認。レコードを変更する前に必ず通す。 */
  StaffUserRecord resolveTrackedUser(String userId) {
    final StaffUserRecord user =
        staffUserRepository
            .findByUserId(userId)
            .orElseThrow(
                () ->
                    new AttendanceRuleException(
                        AttendanceErrorCode.USER_NOT_FOUND, "user not found: " + userId));
    if (!user.isActive()) {
      throw new AttendanceRuleException(
          AttendanceErrorCode.USER_INACTIVE, "user is inactive: " + userId);
    }
    if (!user.isTracked()) {
      throw new AttendanceRuleException(
          AttendanceErrorCode.ROLE_NOT_TRACKED, "attendance is not tracked for role " + user.role());
    }
    return user;
  }

  private AttendanceResult applyAndNotify(StaffUserRecord user, AttendanceCommand command) {
    final Applied applied = apply(command);
    final AttendanceResult result = applied.result();
    metrics.recordTransition(command.type(), result.outcome().name());
    logger.info(
        "attendance event handled event={} userId={} date={} outcome={} status={}",
        command.type(),
        command.userId(),
        command.workDate(),
        result.outcome(),
        result.record() == null ? null : result.record().status());
    if (applied.notification() != null) {
      notificationQueueService.enqueue(
          user.userId(), messageFor(user, result.record(), applied.notification()),
          applied.notification());
    }
    return result;
  }

  /**
   * 再読込 → 判定 → 条件付き書き込みを、競合がなくなるまで上限回数だけ繰り返す。
   */
  Applied apply(AttendanceCommand command) {
    final int maxAttempts = properties.transitionMaxAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      final AttendanceRecord current =
          attendanceRepository.find(command.userId(), command.workDate()).orElse(null);
      final AttendanceTransition transition = stateMachine.decide(command, current);
      switch (transition.kind()) {
        case REJECT -> throw new AttendanceRuleException(transition.errorCode(), transition.reason());
        case DUPLICATE -> {
          return new Applied(AttendanceResult.duplicate(current, transition.errorCode()), null);
        }
        case CREATE -> {
          try {
            final AttendanceRecord inserted = attendanceRepository.insert(transition.target());
            return new Applied(AttendanceResult.applied(inserted), transition.notification());
          } catch (AttendanceUniquenessViolationException ex) {
            // 同じキーの登録に負けた。既存行を読み直して判定をやり直す
            metrics.recordRaceAbsorbed();
            logger.info(
                "attendance insert lost race; re-applying userId={} date={} attempt={}",
                command.userId(),
                command.workDate(),
                attempt);
          }
        }
        case UPDATE -> {
          final Optional<AttendanceRecord> updated =
              attendanceRepository.updateIfVersion(transition.target(), current.version());
          if (updated.isPresent()) {
            return new Applied(AttendanceResult.applied(updated.get()), transition.notification());
          }
          metrics.recordRaceAbsorbed();
          logger.info(
              "attendance update lost race; re-applying userId={} date={} attempt={}",
              command.userId(),
              command.workDate(),
              attempt);
        }
        default -> throw new IllegalStateException(
            "unexpected transition kind for " + command.type() + ": " + transition.kind());
      }
    }
    throw new IllegalStateException(
        "attendance transition did not converge event="
            + command.type()
            + " userId="
            + command.userId()
            + " date="
            + command.workDate());
  }

  private String messageFor(StaffUserRecord user, AttendanceRecord record, NotificationType type) {
    return switch (type) {
      case LOGIN -> messageFormatter.loginMessage(user, record);
      case LOGOUT -> messageFormatter.logoutMessage(user, record);
      default -> throw new IllegalArgumentException("no attendance message for type " + type);
    };
  }

  private void rejectPastDate(LocalDate workDate, Instant now) {
    final LocalDate today = workDateOf(now);
    if (workDate.isBefore(today)) {
      throw new AttendanceRuleException(
          AttendanceErrorCode.PAST_DATE, "cannot declare attendance for past date " + workDate);
    }
  }

  private LocalDate workDateOf(Instant instant) {
    return LocalDate.ofInstant(instant, clock.getZone());
  }

  record Applied(AttendanceResult result, NotificationType notification) {}
}
