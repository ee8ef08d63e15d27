/*
 * どこで: Attendance 設定
 * 何を: 在宅登録済みの日にログインがあった場合の扱いを選ぶ
 * なぜ: 勤務形態を在宅のまま残すか出社へ戻すかを運用で切り替えられるようにするため
 */
package com.example.attendance.config;

public enum RemoteLoginPolicy {
  /** work_type は REMOTE のまま、status は PRESENT に昇格する */
  KEEP_REMOTE,
  /** work_type を OFFICE に戻し、status は PRESENT に昇格する */
  REVERT_TO_OFFICE
}
