/*
 * どこで: Attendance ドメインモデル
 * 何を: 勤務形態を表す列挙
 * なぜ: 「出社していない理由」を状態とは別に保持するため
 */
package com.example.attendance.model;

public enum WorkType {
  OFFICE,
  REMOTE,
  LEAVE
}
