/*
 * どこで: Attendance データアクセス
 * 何を: staff_users の参照を行う
 * なぜ: イベント受付時の在籍確認と通知宛先の解決に使うため
 */
package com.example.attendance.repository;

import static com.example.common.JdbcTimestampUtils.toSqlDate;

import com.example.attendance.model.StaffRole;
import com.example.attendance.model.StaffStatus;
import com.example.attendance.model.StaffUserRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class StaffUserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<StaffUserRecord> findByUserId(String userId) {
    final String sql =
        """
        SELECT user_id, display_name, role, status, contact_address, department
        FROM staff_users
        WHERE user_id = :userId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 指定日に出勤/休暇/在宅のいずれの記録も持たないアクティブな STAFF を返す。
   * 欠勤として記録済みのユーザも含む。
   */
  public List<StaffUserRecord> findActiveStaffWithoutAttendance(LocalDate workDate) {
    final String sql =
        """
        SELECT u.user_id, u.display_name, u.role, u.status, u.contact_address, u.department
        FROM staff_users u
        WHERE u.role = 'STAFF'
          AND u.status = 'ACTIVE'
          AND NOT EXISTS (
            SELECT 1
            FROM attendance_records a
            WHERE a.user_id = u.user_id
              AND a.work_date = :workDate
              AND a.status <> 'ABSENT'
          )
        ORDER BY u.display_name, u.user_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("workDate", toSqlDate(workDate));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countActiveStaff() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM staff_users WHERE role = 'STAFF' AND status = 'ACTIVE'",
            new MapSqlParameterSource(),
            Integer.class);
    return count == null ? 0 : count;
  }

  private StaffUserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new StaffUserRecord(
        rs.getString("user_id"),
        rs.getString("display_name"),
        StaffRole.valueOf(rs.getString("role")),
        StaffStatus.valueOf(rs.getString("status")),
        rs.getString("contact_address"),
        rs.getString("department"));
  }
}
