/*
 * どこで: NotificationRepository の統合テスト
 * 何を: claim の順序保証・終端状態の冪等性・期限切れ claim の失敗化を検証する
 * なぜ: FOR UPDATE SKIP LOCKED を使った claim の挙動を実 DB で確認するため
 */
package com.example.attendance.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.attendance.AbstractPostgresContainerTest;
import com.example.attendance.model.NotificationRecord;
import com.example.attendance.model.NotificationStatus;
import com.example.attendance.model.NotificationType;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-02T03:35:00Z");

  @Autowired private NotificationRepository notificationRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
  }

  @Test
  void claimPendingTakesOnlyTheOldestEntryPerUser() {
    final long login = notificationRepository.insertPending("u-1", "in", NotificationType.LOGIN, NOW);
    final long logout =
        notificationRepository.insertPending("u-1", "out", NotificationType.LOGOUT, NOW);
    final long other =
        notificationRepository.insertPending("u-2", "in", NotificationType.LOGIN, NOW);

    final List<NotificationRecord> firstCycle = notificationRepository.claimPending(10, NOW, "host-a");

    assertThat(firstCycle).extracting(NotificationRecord::notificationId).containsExactly(login, other);
    assertThat(firstCycle).allSatisfy(record -> assertThat(record.lockedBy()).isEqualTo("host-a"));

    // ログイン通知が終端になるまでログアウト通知は claim されない
    assertThat(notificationRepository.claimPending(10, NOW, "host-b")).isEmpty();

    notificationRepository.markSent(login, NOW);
    final List<NotificationRecord> secondCycle =
        notificationRepository.claimPending(10, NOW, "host-b");

    assertThat(secondCycle).extracting(NotificationRecord::notificationId).containsExactly(logout);
  }

  @Test
  void markSentAndMarkFailedOnlyChangePendingRows() {
    final long id = notificationRepository.insertPending("u-1", "in", NotificationType.LOGIN, NOW);

    assertThat(notificationRepository.markSent(id, NOW)).isEqualTo(1);
    assertThat(notificationRepository.markSent(id, NOW.plusSeconds(5))).isZero();
    assertThat(notificationRepository.markFailed(id, "late failure")).isZero();

    final NotificationRecord stored = notificationRepository.findByUserId("u-1").get(0);
    assertThat(stored.status()).isEqualTo(NotificationStatus.SENT);
    assertThat(stored.sentAt()).isEqualTo(NOW);
    assertThat(stored.errorMessage()).isNull();
    assertThat(stored.lockedBy()).isNull();
  }

  @Test
  void failStaleClaimsMarksExpiredClaimsFailedWithoutReleasingThem() {
    final long stale = notificationRepository.insertPending("u-1", "in", NotificationType.LOGIN, NOW);
    final long unclaimed =
        notificationRepository.insertPending("u-2", "in", NotificationType.LOGIN, NOW);
    notificationRepository.claimPending(1, NOW, "crashed-host");

    final int failed =
        notificationRepository.failStaleClaims(NOW.plusSeconds(61), "delivery outcome unknown");

    assertThat(failed).isEqualTo(1);
    assertThat(notificationRepository.findByUserId("u-1").get(0))
        .satisfies(
            record -> {
              assertThat(record.notificationId()).isEqualTo(stale);
              assertThat(record.status()).isEqualTo(NotificationStatus.FAILED);
              assertThat(record.errorMessage()).isEqualTo("delivery outcome unknown");
            });
    assertThat(notificationRepository.findByUserId("u-2").get(0).notificationId())
        .isEqualTo(unclaimed);
    assertThat(notificationRepository.countPending()).isEqualTo(1);
  }

  @Test
  void findByUserIdReturnsNewestFirst() {
    final long first = notificationRepository.insertPending("u-1", "in", NotificationType.LOGIN, NOW);
    final long second =
        notificationRepository.insertPending("u-1", "out", NotificationType.LOGOUT, NOW);

    assertThat(notificationRepository.findByUserId("u-1"))
        .extracting(NotificationRecord::notificationId)
        .containsExactly(second, first);
  }
}
