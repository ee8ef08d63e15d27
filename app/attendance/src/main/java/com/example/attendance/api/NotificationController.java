/*
 * どこで: Notification API
 * 何を: ユーザごとの通知一覧を返す
 * なぜ: 送信済み/失敗の記録を利用者が確認できるようにするため
 */
package com.example.attendance.api;

import com.example.attendance.api.response.NotificationInboxResponse;
import com.example.attendance.api.response.NotificationSummary;
import com.example.attendance.service.NotificationQueueService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class NotificationController {

  private final NotificationQueueService notificationQueueService;

  @GetMapping("/v1/users/{userId}/notifications")
  public ResponseEntity<NotificationInboxResponse> inbox(@PathVariable("userId") String userId) {
    final List<NotificationSummary> notifications =
        notificationQueueService.inbox(userId).stream().map(NotificationSummary::from).toList();
    return ResponseEntity.ok(new NotificationInboxResponse(userId, notifications));
  }
}
