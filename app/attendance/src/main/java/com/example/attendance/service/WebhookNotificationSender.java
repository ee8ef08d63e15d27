/*
 * どこで: Notification サービス層
 * 何を: HTTP の外部メッセージ配信チャネルへ通知を送る Sender
 * なぜ: チャネルの応答・タイムアウト・接続失敗を失敗理由つきの結果へ正規化するため
 */
package com.example.attendance.service;

import com.example.attendance.config.NotificationWebhookProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@ConditionalOnProperty(name = "notification.channel", havingValue = "webhook")
public class WebhookNotificationSender implements NotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(WebhookNotificationSender.class);

  private final RestClient notificationRestClient;
  private final NotificationWebhookProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public WebhookNotificationSender(
      RestClient notificationRestClient, NotificationWebhookProperties properties) {
    this.notificationRestClient = notificationRestClient;
    this.properties = properties;
  }

  @Override
  public DeliveryResult send(String address, String message) {
    try {
      notificationRestClient
          .post()
          .uri(properties.sendPath())
          .contentType(MediaType.APPLICATION_JSON)
          .body(new WebhookMessage(address, message))
          .retrieve()
          .toBodilessEntity();
      return DeliveryResult.ok();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "notification channel rejected message status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      return DeliveryResult.failure("channel responded with status " + ex.getStatusCode().value());
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("notification channel timed out");
        return DeliveryResult.failure("channel call timed out");
      }
      logger.warn("notification channel connection failed", ex);
      return DeliveryResult.failure("channel connection failed: " + ex.getMessage());
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record WebhookMessage(String to, String body) {}
}
