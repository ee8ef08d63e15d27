/*
 * どこで: Notification データアクセス
 * 何を: notifications テーブルの登録/claim/終端状態への更新を担う
 * なぜ: 配信処理と受信箱 API を支え、配信結果を監査ログとして残すため
 */
package com.example.attendance.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.attendance.model.NotificationRecord;
import com.example.attendance.model.NotificationStatus;
import com.example.attendance.model.NotificationType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insertPending(String userId, String message, NotificationType type, Instant createdAt) {
    final String sql =
        """
        INSERT INTO notifications (user_id, message, type, status, created_at)
        VALUES (:userId, :message, :type, 'PENDING', :createdAt)
        RETURNING notification_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("message", message)
            .addValue("type", type.name())
            .addValue("createdAt", toTimestamp(createdAt));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("notification insert returned no id");
    }
    return id;
  }

  public List<NotificationRecord> findByUserId(String userId) {
    final String sql =
        """
        SELECT notification_id, user_id, message, type, status, sent_at, error_message,
               locked_by, locked_at, created_at
        FROM notifications
        WHERE user_id = :userId
        ORDER BY notification_id DESC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * 未 claim の PENDING を古い順に claim する。同じユーザに先行する PENDING がある行は
   * 対象外とし、ユーザ単位の送信順(ログイン通知 → ログアウト通知)を保つ。
   */
  public List<NotificationRecord> claimPending(int limit, Instant now, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT n.notification_id
          FROM notifications n
          WHERE n.status = 'PENDING'
            AND n.locked_by IS NULL
            AND NOT EXISTS (
              SELECT 1
              FROM notifications earlier
              WHERE earlier.user_id = n.user_id
                AND earlier.status = 'PENDING'
                AND earlier.notification_id < n.notification_id
            )
          ORDER BY n.notification_id
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notifications n
        SET locked_by = :lockedBy,
            locked_at = :now
        FROM cte
        WHERE n.notification_id = cte.notification_id
          AND n.locked_by IS NULL
        RETURNING n.notification_id, n.user_id, n.message, n.type, n.status, n.sent_at,
                  n.error_message, n.locked_by, n.locked_at, n.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow).stream()
        .sorted(Comparator.comparingLong(NotificationRecord::notificationId))
        .toList();
  }

  /** PENDING の行だけを SENT にする。既に終端状態なら 0 を返す。 */
  public int markSent(long notificationId, Instant sentAt) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'SENT',
            sent_at = :sentAt,
            locked_by = NULL,
            locked_at = NULL
        WHERE notification_id = :notificationId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  /** PENDING の行だけを FAILED にする。既に終端状態なら 0 を返す。 */
  public int markFailed(long notificationId, String errorMessage) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'FAILED',
            error_message = :errorMessage,
            locked_by = NULL,
            locked_at = NULL
        WHERE notification_id = :notificationId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("errorMessage", errorMessage)
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * claim 後に結果が記録されないまま threshold を過ぎた行を FAILED にする。
   * 再送はしないため、1 件の通知が 2 回送信されることはない。
   */
  public int failStaleClaims(Instant threshold, String errorMessage) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'FAILED',
            error_message = :errorMessage,
            locked_by = NULL,
            locked_at = NULL
        WHERE status = 'PENDING'
          AND locked_by IS NOT NULL
          AND locked_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("errorMessage", errorMessage)
            .addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countPending() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM notifications WHERE status = 'PENDING'",
            new MapSqlParameterSource(),
            Integer.class);
    return count == null ? 0 : count;
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getLong("notification_id"),
        rs.getString("user_id"),
        rs.getString("message"),
        NotificationType.valueOf(rs.getString("type")),
        NotificationStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("sent_at")),
        rs.getString("error_message"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("created_at")));
  }
}
