/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant/LocalDate と java.sql 型を明示変換する
 * なぜ: PostgreSQL JDBC の型推論に依存せず、勤怠日付と時刻を常に同じ型でバインドするため
 */
package com.example.common;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC として Timestamp.from でそのまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  // 勤怠日はタイムゾーンを持たない暦日として DATE 列へ渡す
  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
