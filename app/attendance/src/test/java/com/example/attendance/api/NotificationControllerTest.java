package com.example.attendance.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.attendance.model.NotificationRecord;
import com.example.attendance.model.NotificationStatus;
import com.example.attendance.model.NotificationType;
import com.example.attendance.service.NotificationQueueService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NotificationController.class)
@Import(ApiExceptionHandler.class)
class NotificationControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationQueueService notificationQueueService;

  @Test
  void inboxReturnsDeliveryStateAndReason() throws Exception {
    final Instant now = Instant.parse("2026-03-02T12:00:00Z");
    when(notificationQueueService.inbox("u-1"))
        .thenReturn(
            List.of(
                new NotificationRecord(
                    2L, "u-1", "bye", NotificationType.LOGOUT, NotificationStatus.FAILED, null,
                    "channel call timed out", null, null, now),
                new NotificationRecord(
                    1L, "u-1", "hi", NotificationType.LOGIN, NotificationStatus.SENT, now, null,
                    null, null, now)));

    mockMvc
        .perform(get("/v1/users/u-1/notifications"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value("u-1"))
        .andExpect(jsonPath("$.notifications[0].notification_id").value(2))
        .andExpect(jsonPath("$.notifications[0].status").value("FAILED"))
        .andExpect(jsonPath("$.notifications[0].error_message").value("channel call timed out"))
        .andExpect(jsonPath("$.notifications[1].type").value("LOGIN"));
  }
}
