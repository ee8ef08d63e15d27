/*
 * どこで: Notification 配信サービスのユニットテスト
 * 何を: 1 回限りの送信と結果の記録、宛先欠落や例外時の失敗記録を検証する
 * なぜ: 配信失敗が再送されず、監査ログとして残ることを保証するため
 */
package com.example.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.attendance.config.NotificationDeliveryProperties;
import com.example.attendance.model.NotificationRecord;
import com.example.attendance.model.NotificationStatus;
import com.example.attendance.model.NotificationType;
import com.example.attendance.model.StaffRole;
import com.example.attendance.model.StaffStatus;
import com.example.attendance.model.StaffUserRecord;
import com.example.attendance.repository.NotificationRepository;
import com.example.attendance.repository.StaffUserRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class NotificationDeliveryServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-02T12:00:00Z");
  private static final NotificationDeliveryProperties PROPERTIES =
      new NotificationDeliveryProperties(true, Duration.ofSeconds(2), 50, 1000, Duration.ofSeconds(60));

  @Mock private NotificationRepository notificationRepository;
  @Mock private StaffUserRepository staffUserRepository;
  @Mock private NotificationQueueService queueService;
  @Mock private NotificationSender sender;
  @Mock private NotificationMetrics metrics;

  private NotificationDeliveryService service;

  @BeforeEach
  void setUp() {
    // 時刻に依存する処理が混ざってもテストが揺れないよう固定クロックを注入する
    final Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    service =
        new NotificationDeliveryService(
            notificationRepository,
            staffUserRepository,
            queueService,
            sender,
            PROPERTIES,
            metrics,
            clock);
  }

  @Test
  void deliverMarksSentOnSuccess() {
    when(staffUserRepository.findByUserId("u-1")).thenReturn(Optional.of(staff("+91-1")));
    when(sender.send("+91-1", "hello")).thenReturn(DeliveryResult.ok());
    when(queueService.markSent(1L, FIXED_NOW)).thenReturn(true);

    assertThat(service.deliver(record(1L, "u-1"))).isTrue();

    verify(metrics).recordDeliveryResult("sent");
  }

  @Test
  void deliverMarksFailedWithChannelReason() {
    when(staffUserRepository.findByUserId("u-1")).thenReturn(Optional.of(staff("+91-1")));
    when(sender.send("+91-1", "hello")).thenReturn(DeliveryResult.failure("channel responded with status 503"));
    when(queueService.markFailed(1L, "channel responded with status 503")).thenReturn(true);

    assertThat(service.deliver(record(1L, "u-1"))).isTrue();

    verify(metrics).recordDeliveryResult("failed");
  }

  @Test
  void deliverTreatsThrownExceptionAsFailure() {
    when(staffUserRepository.findByUserId("u-1")).thenReturn(Optional.of(staff("+91-1")));
    when(sender.send(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));
    when(queueService.markFailed(1L, "boom")).thenReturn(true);

    assertThat(service.deliver(record(1L, "u-1"))).isTrue();
  }

  @Test
  void deliverFailsWithoutCallingChannelWhenAddressMissing() {
    when(staffUserRepository.findByUserId("u-1")).thenReturn(Optional.of(staff(null)));
    when(queueService.markFailed(1L, NotificationDeliveryService.MISSING_ADDRESS_ERROR))
        .thenReturn(true);

    service.deliver(record(1L, "u-1"));

    verifyNoInteractions(sender);
  }

  @Test
  void processPendingBatchFailsStaleClaimsBeforeClaiming() {
    when(notificationRepository.claimPending(eq(50), eq(FIXED_NOW), anyString()))
        .thenReturn(List.of());
    when(notificationRepository.countPending()).thenReturn(4);

    final int processed = service.processPendingBatch();

    assertThat(processed).isZero();
    verify(notificationRepository)
        .failStaleClaims(
            FIXED_NOW.minusSeconds(60), NotificationDeliveryService.STALE_CLAIM_ERROR);
    verify(metrics).updateBacklogCurrent(4);
  }

  @Test
  void processPendingBatchContinuesWhenRecordingOneResultFails() {
    when(notificationRepository.claimPending(anyInt(), any(), anyString()))
        .thenReturn(List.of(record(1L, "u-1"), record(2L, "u-2")));
    when(staffUserRepository.findByUserId(anyString()))
        .thenAnswer(invocation -> Optional.of(staff("+91-" + invocation.getArgument(0))));
    when(sender.send(anyString(), anyString())).thenReturn(DeliveryResult.ok());
    doThrow(new QueryTimeoutException("db timeout")).when(queueService).markSent(1L, FIXED_NOW);
    when(queueService.markSent(2L, FIXED_NOW)).thenReturn(true);

    final int processed = service.processPendingBatch();

    assertThat(processed).isEqualTo(1);
    verify(queueService).markSent(2L, FIXED_NOW);
  }

  @Test
  void resolveLockedByReturnsNonBlankValue() {
    assertThat(service.resolveLockedBy()).isNotBlank();
  }

  private StaffUserRecord staff(String contactAddress) {
    return new StaffUserRecord(
        "u-1", "Asha", StaffRole.STAFF, StaffStatus.ACTIVE, contactAddress, null);
  }

  private NotificationRecord record(long id, String userId) {
    return new NotificationRecord(
        id,
        userId,
        "hello",
        NotificationType.LOGIN,
        NotificationStatus.PENDING,
        null,
        null,
        "host",
        FIXED_NOW,
        FIXED_NOW);
  }
}
