/*
 * どこで: Attendance ドメインモデル
 * 何を: スタッフのロールを表す列挙
 * なぜ: 勤怠追跡の対象(STAFF)と管理者を型で区別するため
 */
package com.example.attendance.model;

public enum StaffRole {
  STAFF,
  ADMIN
}
