/*
 * どこで: Attendance サービス層
 * 何を: (イベント種別, 既存レコードの状態) から次の状態と副作用を決める遷移表
 * なぜ: 状態文字列による分岐を排し、遷移規則を 1 か所で明示するため
 */
package com.example.attendance.service;

import com.example.attendance.config.AttendanceProperties;
import com.example.attendance.config.RemoteLoginPolicy;
import com.example.attendance.model.AttendanceEventType;
import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.model.AttendanceStatus;
import com.example.attendance.model.NotificationType;
import com.example.attendance.model.RecordState;
import com.example.attendance.model.WorkType;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class AttendanceStateMachine {

  @FunctionalInterface
  interface TransitionRule {
    AttendanceTransition apply(AttendanceCommand command, AttendanceRecord current, RecordState state);
  }

  private final RemoteLoginPolicy remoteLoginPolicy;
  private final Map<AttendanceEventType, TransitionRule> rules =
      new EnumMap<>(AttendanceEventType.class);

  public AttendanceStateMachine(AttendanceProperties properties) {
    this.remoteLoginPolicy = properties.remoteLoginPolicy();
    rules.put(AttendanceEventType.LOGIN, this::onLogin);
    rules.put(AttendanceEventType.LOGOUT, this::onLogout);
    rules.put(AttendanceEventType.LEAVE_REQUEST, this::onLeaveRequest);
    rules.put(AttendanceEventType.REMOTE_MARK, this::onRemoteMark);
    rules.put(AttendanceEventType.ABSENCE_SWEEP, this::onAbsenceSweep);
  }

  /**
   * 遷移を判定する。副作用は持たず、永続化は呼び出し側が行う。
   *
   * @param current 対象日の既存レコード。無ければ null
   */
  public AttendanceTransition decide(AttendanceCommand command, AttendanceRecord current) {
    final TransitionRule rule = rules.get(command.type());
    if (rule == null) {
      throw new IllegalArgumentException("unsupported attendance event: " + command.type());
    }
    return rule.apply(command, current, RecordState.of(current));
  }

  private AttendanceTransition onLogin(
      AttendanceCommand command, AttendanceRecord current, RecordState state) {
    return switch (state) {
      case NONE -> AttendanceTransition.create(
          AttendanceRecord.create(
              command.userId(),
              command.workDate(),
              command.occurredAt(),
              AttendanceStatus.PRESENT,
              WorkType.OFFICE,
              null,
              command.occurredAt()),
          NotificationType.LOGIN);
      case SCHEDULED -> AttendanceTransition.update(
          promoteOnLogin(current, command), NotificationType.LOGIN);
      case OPEN, CLOSED -> AttendanceTransition.duplicate(
          AttendanceErrorCode.DUPLICATE_LOGIN, "login already recorded for " + command.workDate());
    };
  }

  private AttendanceRecord promoteOnLogin(AttendanceRecord current, AttendanceCommand command) {
    if (current.status() == AttendanceStatus.LEAVE) {
      // 休暇日のログインは時刻だけ残し、休暇扱いは変えない
      return current.withLogin(
          command.occurredAt(), AttendanceStatus.LEAVE, current.workType(), command.occurredAt());
    }
    if (current.status() == AttendanceStatus.REMOTE) {
      final WorkType workType =
          remoteLoginPolicy == RemoteLoginPolicy.REVERT_TO_OFFICE ? WorkType.OFFICE : WorkType.REMOTE;
      return current.withLogin(
          command.occurredAt(), AttendanceStatus.PRESENT, workType, command.occurredAt());
    }
    final WorkType workType =
        current.workType() == WorkType.LEAVE ? WorkType.OFFICE : current.workType();
    return current.withLogin(
        command.occurredAt(), AttendanceStatus.PRESENT, workType, command.occurredAt());
  }

  private AttendanceTransition onLogout(
      AttendanceCommand command, AttendanceRecord current, RecordState state) {
    return switch (state) {
      case NONE -> AttendanceTransition.reject(
          AttendanceErrorCode.RECORD_NOT_FOUND, "no attendance record for " + command.workDate());
      case SCHEDULED -> AttendanceTransition.reject(
          AttendanceErrorCode.RECORD_NOT_FOUND, "no login recorded for " + command.workDate());
      case OPEN -> closeDay(command, current);
      case CLOSED -> AttendanceTransition.duplicate(
          AttendanceErrorCode.DUPLICATE_LOGOUT, "logout already recorded for " + command.workDate());
    };
  }

  private AttendanceTransition closeDay(AttendanceCommand command, AttendanceRecord current) {
    if (command.occurredAt().isBefore(current.loginTime())) {
      return AttendanceTransition.reject(
          AttendanceErrorCode.INVALID_ORDERING,
          "logout " + command.occurredAt() + " is before login " + current.loginTime());
    }
    return AttendanceTransition.update(
        current.withLogout(command.occurredAt(), command.occurredAt()), NotificationType.LOGOUT);
  }

  private AttendanceTransition onLeaveRequest(
      AttendanceCommand command, AttendanceRecord current, RecordState state) {
    return declare(command, current, state, AttendanceStatus.LEAVE, WorkType.LEAVE);
  }

  private AttendanceTransition onRemoteMark(
      AttendanceCommand command, AttendanceRecord current, RecordState state) {
    return declare(command, current, state, AttendanceStatus.REMOTE, WorkType.REMOTE);
  }

  // 休暇/在宅の申告は通知を出さない
  private AttendanceTransition declare(
      AttendanceCommand command,
      AttendanceRecord current,
      RecordState state,
      AttendanceStatus status,
      WorkType workType) {
    return switch (state) {
      case NONE -> AttendanceTransition.create(
          AttendanceRecord.create(
              command.userId(),
              command.workDate(),
              null,
              status,
              workType,
              command.notes(),
              command.occurredAt()),
          null);
      case SCHEDULED -> AttendanceTransition.update(
          current.withDeclaration(status, workType, command.notes(), command.occurredAt()), null);
      case OPEN, CLOSED -> AttendanceTransition.reject(
          AttendanceErrorCode.CONFLICTING_RECORD,
          "attendance already worked on " + command.workDate());
    };
  }

  private AttendanceTransition onAbsenceSweep(
      AttendanceCommand command, AttendanceRecord current, RecordState state) {
    if (state != RecordState.NONE) {
      return AttendanceTransition.skip();
    }
    return AttendanceTransition.create(
        AttendanceRecord.create(
            command.userId(),
            command.workDate(),
            null,
            AttendanceStatus.ABSENT,
            WorkType.OFFICE,
            null,
            command.occurredAt()),
        null);
  }
}
