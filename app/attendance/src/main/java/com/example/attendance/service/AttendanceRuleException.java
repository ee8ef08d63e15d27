/*
 * どこで: Attendance サービス層
 * 何を: 利用者操作の誤り(重複・順序違反・対象外ユーザ等)を表す例外
 * なぜ: 自動リトライせず、呼び出し元へ同期的に返すため
 */
package com.example.attendance.service;

public class AttendanceRuleException extends RuntimeException {

  private final AttendanceErrorCode code;

  public AttendanceRuleException(AttendanceErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public AttendanceErrorCode code() {
    return code;
  }
}
