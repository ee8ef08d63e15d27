/*
 * どこで: Notification サービス層
 * 何を: CI/Test 専用で通知送信失敗を注入する Sender
 * なぜ: 実コード経路を汚さずに配信失敗時の記録を再現するため
 */
package com.example.attendance.service;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.delivery.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingNotificationSender implements NotificationSender {

  private final LocalNotificationSender delegate;

  @Value("${notification.delivery.failure-injection.address-prefix:}")
  private String addressPrefix;

  @Override
  public DeliveryResult send(String address, String message) {
    if (shouldInjectFailure(address)) {
      return DeliveryResult.failure("notification delivery failure injection matched address=" + address);
    }
    return delegate.send(address, message);
  }

  private boolean shouldInjectFailure(String address) {
    if (addressPrefix == null || addressPrefix.isBlank()) {
      return false;
    }
    return address != null && address.startsWith(addressPrefix);
  }
}
