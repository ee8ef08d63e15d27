/*
 * どこで: Notification サービス層
 * 何を: 管理者からの任意のリマインダー通知を登録する
 * なぜ: 勤怠以外の通知も同じ配信経路と監査ログに載せるため
 */
package com.example.attendance.service;

import com.example.attendance.model.NotificationType;
import com.example.attendance.repository.StaffUserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReminderService {

  private final StaffUserRepository staffUserRepository;
  private final NotificationQueueService notificationQueueService;

  public long sendReminder(String userId, String message) {
    if (staffUserRepository.findByUserId(userId).isEmpty()) {
      throw new AttendanceRuleException(
          AttendanceErrorCode.USER_NOT_FOUND, "user not found: " + userId);
    }
    return notificationQueueService.enqueueStrict(userId, message, NotificationType.REMINDER);
  }
}
