/*
 * どこで: Attendance ドメインモデル
 * 何を: staff_users テーブル(ID 基盤が所有)の読み取り用スナップショット
 * なぜ: 勤怠判定と通知宛先の解決で同じユーザ情報を使うため
 */
package com.example.attendance.model;

public record StaffUserRecord(
    String userId,
    String displayName,
    StaffRole role,
    StaffStatus status,
    String contactAddress,
    String department) {

  public boolean isActive() {
    return status == StaffStatus.ACTIVE;
  }

  public boolean isTracked() {
    return role == StaffRole.STAFF;
  }
}
