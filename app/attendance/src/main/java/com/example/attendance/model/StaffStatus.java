/*
 * どこで: Attendance ドメインモデル
 * 何を: スタッフの在籍状態を表す列挙
 * なぜ: 非アクティブなユーザのイベントを記録更新前に拒否するため
 */
package com.example.attendance.model;

public enum StaffStatus {
  ACTIVE,
  INACTIVE
}
