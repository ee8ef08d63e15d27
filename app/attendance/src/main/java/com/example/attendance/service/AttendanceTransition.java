/*
 * どこで: Attendance サービス層
 * 何を: 状態遷移表の 1 セル(次の状態と副作用)を表す
 * なぜ: 遷移の判定と永続化を分離し、判定だけを単体で検証できるようにするため
 */
package com.example.attendance.service;

import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.model.NotificationType;

public record AttendanceTransition(
    Kind kind,
    AttendanceRecord target,
    NotificationType notification,
    AttendanceErrorCode errorCode,
    String reason) {

  public enum Kind {
    /** 新規行を登録する */
    CREATE,
    /** 既存行を version 条件付きで更新する */
    UPDATE,
    /** 重複イベント。既存行をそのまま返す */
    DUPLICATE,
    /** 対象外。既存行をそのまま返す */
    SKIP,
    /** 拒否 */
    REJECT
  }

  public static AttendanceTransition create(AttendanceRecord target, NotificationType notification) {
    return new AttendanceTransition(Kind.CREATE, target, notification, null, null);
  }

  public static AttendanceTransition update(AttendanceRecord target, NotificationType notification) {
    return new AttendanceTransition(Kind.UPDATE, target, notification, null, null);
  }

  public static AttendanceTransition duplicate(AttendanceErrorCode code, String reason) {
    return new AttendanceTransition(Kind.DUPLICATE, null, null, code, reason);
  }

  public static AttendanceTransition skip() {
    return new AttendanceTransition(Kind.SKIP, null, null, null, null);
  }

  public static AttendanceTransition reject(AttendanceErrorCode code, String reason) {
    return new AttendanceTransition(Kind.REJECT, null, null, code, reason);
  }
}
