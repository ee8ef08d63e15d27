/*
 * どこで: Attendance データアクセス
 * 何を: attendance_records の登録/条件付き更新/参照を担う
 * なぜ: 1 日 1 レコードの一意性を DB 制約だけで保証するため
 */
package com.example.attendance.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toLocalDate;
import static com.example.common.JdbcTimestampUtils.toSqlDate;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.attendance.model.AttendanceRecord;
import com.example.attendance.model.AttendanceStatus;
import com.example.attendance.model.WorkType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AttendanceRepository {

  private static final String COLUMNS =
      """
      user_id, work_date, login_time, logout_time, status, work_type, notes,
      version, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<AttendanceRecord> find(String userId, LocalDate workDate) {
    final String sql =
        "SELECT " + COLUMNS
            + """
            FROM attendance_records
            WHERE user_id = :userId
              AND work_date = :workDate
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("workDate", toSqlDate(workDate));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 新規レコードを登録する。同じ (user_id, work_date) が既にあれば
   * {@link AttendanceUniquenessViolationException} を投げ、既存行は変更しない。
   */
  public AttendanceRecord insert(AttendanceRecord record) {
    final String sql =
        """
        INSERT INTO attendance_records (
          user_id, work_date, login_time, logout_time, status, work_type, notes,
          version, created_at, updated_at
        ) VALUES (
          :userId, :workDate, :loginTime, :logoutTime, :status, :workType, :notes,
          0, :createdAt, :updatedAt
        )
        RETURNING
        """
            + COLUMNS;
    try {
      return jdbcTemplate.queryForObject(sql, recordParams(record), this::mapRow);
    } catch (DuplicateKeyException ex) {
      throw new AttendanceUniquenessViolationException(record.userId(), record.workDate(), ex);
    }
  }

  /** 既存行には触れずに登録を試みる。登録できた件数(0 or 1)を返す。 */
  public int insertIfAbsent(AttendanceRecord record) {
    final String sql =
        """
        INSERT INTO attendance_records (
          user_id, work_date, login_time, logout_time, status, work_type, notes,
          version, created_at, updated_at
        ) VALUES (
          :userId, :workDate, :loginTime, :logoutTime, :status, :workType, :notes,
          0, :createdAt, :updatedAt
        )
        ON CONFLICT (user_id, work_date) DO NOTHING
        """;
    return jdbcTemplate.update(sql, recordParams(record));
  }

  /**
   * version が一致する場合のみ 1 行を更新する。他の書き込みが先行していれば空を返す。
   */
  public Optional<AttendanceRecord> updateIfVersion(AttendanceRecord record, long expectedVersion) {
    final String sql =
        """
        UPDATE attendance_records
        SET login_time = :loginTime,
            logout_time = :logoutTime,
            status = :status,
            work_type = :workType,
            notes = :notes,
            version = version + 1,
            updated_at = :updatedAt
        WHERE user_id = :userId
          AND work_date = :workDate
          AND version = :expectedVersion
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        recordParams(record).addValue("expectedVersion", expectedVersion);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 指定日にレコードを持たないアクティブな STAFF の ID を 1 クエリの差集合で返す。
   */
  public List<String> findUserIdsMissingRecord(LocalDate workDate) {
    final String sql =
        """
        SELECT u.user_id
        FROM staff_users u
        WHERE u.role = 'STAFF'
          AND u.status = 'ACTIVE'
          AND NOT EXISTS (
            SELECT 1
            FROM attendance_records a
            WHERE a.user_id = u.user_id
              AND a.work_date = :workDate
          )
        ORDER BY u.user_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("workDate", toSqlDate(workDate));
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  public List<AttendanceRecord> findByUserIdBetween(String userId, LocalDate from, LocalDate to) {
    final String sql =
        "SELECT " + COLUMNS
            + """
            FROM attendance_records
            WHERE user_id = :userId
              AND work_date BETWEEN :from AND :to
            ORDER BY work_date DESC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("from", toSqlDate(from))
            .addValue("to", toSqlDate(to));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<AttendanceRecord> findByDate(LocalDate workDate) {
    final String sql =
        "SELECT " + COLUMNS
            + """
            FROM attendance_records
            WHERE work_date = :workDate
            ORDER BY user_id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("workDate", toSqlDate(workDate));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Map<AttendanceStatus, Integer> countByStatus(LocalDate workDate) {
    final String sql =
        """
        SELECT status, COUNT(*) AS record_count
        FROM attendance_records
        WHERE work_date = :workDate
        GROUP BY status
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("workDate", toSqlDate(workDate));
    final Map<AttendanceStatus, Integer> counts = new EnumMap<>(AttendanceStatus.class);
    for (AttendanceStatus status : AttendanceStatus.values()) {
      counts.put(status, 0);
    }
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          counts.put(AttendanceStatus.valueOf(rs.getString("status")), rs.getInt("record_count"));
        });
    return counts;
  }

  private MapSqlParameterSource recordParams(AttendanceRecord record) {
    return new MapSqlParameterSource()
        .addValue("userId", record.userId())
        .addValue("workDate", toSqlDate(record.workDate()))
        .addValue("loginTime", toTimestamp(record.loginTime()))
        .addValue("logoutTime", toTimestamp(record.logoutTime()))
        .addValue("status", record.status().name())
        .addValue("workType", record.workType().name())
        .addValue("notes", record.notes())
        .addValue("createdAt", toTimestamp(record.createdAt()))
        .addValue("updatedAt", toTimestamp(record.updatedAt()));
  }

  private AttendanceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AttendanceRecord(
        rs.getString("user_id"),
        toLocalDate(rs.getDate("work_date")),
        toInstant(rs.getTimestamp("login_time")),
        toInstant(rs.getTimestamp("logout_time")),
        AttendanceStatus.valueOf(rs.getString("status")),
        WorkType.valueOf(rs.getString("work_type")),
        rs.getString("notes"),
        rs.getLong("version"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
