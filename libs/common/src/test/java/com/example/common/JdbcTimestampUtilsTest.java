package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void nullValuesStayNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
    assertThat(JdbcTimestampUtils.toSqlDate(null)).isNull();
    assertThat(JdbcTimestampUtils.toLocalDate(null)).isNull();
  }

  @Test
  void instantSurvivesTimestampConversion() {
    final Instant instant = Instant.parse("2024-03-01T00:05:00Z");

    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(instant);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(instant);
  }

  @Test
  void localDateIsBoundAsCalendarDate() {
    final LocalDate date = LocalDate.of(2024, 3, 1);

    final Date sqlDate = JdbcTimestampUtils.toSqlDate(date);

    assertThat(sqlDate.toString()).isEqualTo("2024-03-01");
    assertThat(JdbcTimestampUtils.toLocalDate(sqlDate)).isEqualTo(date);
  }
}
