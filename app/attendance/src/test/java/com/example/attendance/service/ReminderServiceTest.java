package com.example.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.attendance.model.NotificationType;
import com.example.attendance.model.StaffRole;
import com.example.attendance.model.StaffStatus;
import com.example.attendance.model.StaffUserRecord;
import com.example.attendance.repository.StaffUserRepository;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReminderServiceTest {

  @Mock private StaffUserRepository staffUserRepository;
  @Mock private NotificationQueueService notificationQueueService;

  @InjectMocks private ReminderService service;

  @Test
  void reminderIsQueuedForKnownUser() {
    when(staffUserRepository.findByUserId("u-1"))
        .thenReturn(
            Optional.of(
                new StaffUserRecord("u-1", "Asha", StaffRole.STAFF, StaffStatus.ACTIVE, null, null)));
    when(notificationQueueService.enqueueStrict("u-1", "Submit timesheet", NotificationType.REMINDER))
        .thenReturn(7L);

    assertThat(service.sendReminder("u-1", "Submit timesheet")).isEqualTo(7L);
  }

  @Test
  void reminderForUnknownUserIsRejected() {
    when(staffUserRepository.findByUserId("ghost")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.sendReminder("ghost", "hello"))
        .isInstanceOf(AttendanceRuleException.class)
        .hasMessageContaining("ghost");
    verifyNoInteractions(notificationQueueService);
  }
}
