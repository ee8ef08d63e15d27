/*
 * どこで: WebhookNotificationSender のユニットテスト
 * 何を: 外部チャネルの応答/タイムアウトを送信結果へ変換する挙動を検証する
 * なぜ: チャネル障害が例外ではなく失敗理由つきの結果として記録されることを保証するため
 */
package com.example.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.attendance.config.NotificationWebhookProperties;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class WebhookNotificationSenderTest {

  @Test
  void sendPostsSnakeCaseMessage() {
    final Fixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://channel.test/messages"))
        .andExpect(method(POST))
        .andExpect(content().json("{\"to\":\"+91-1\",\"body\":\"hello\"}"))
        .andRespond(withSuccess());

    final DeliveryResult result = fixture.sender.send("+91-1", "hello");

    assertThat(result.success()).isTrue();
    fixture.server.verify();
  }

  @Test
  void sendReturnsFailureOnServerError() {
    final Fixture fixture = newFixture();
    fixture.server.expect(requestTo("http://channel.test/messages")).andRespond(withServerError());

    final DeliveryResult result = fixture.sender.send("+91-1", "hello");

    assertThat(result.success()).isFalse();
    assertThat(result.reason()).isEqualTo("channel responded with status 500");
  }

  @Test
  void sendReturnsFailureOnTimeout() {
    final Fixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://channel.test/messages"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    final DeliveryResult result = fixture.sender.send("+91-1", "hello");

    assertThat(result.success()).isFalse();
    assertThat(result.reason()).isEqualTo("channel call timed out");
  }

  @Test
  void sendReturnsFailureOnConnectionError() {
    final Fixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://channel.test/messages"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    final DeliveryResult result = fixture.sender.send("+91-1", "hello");

    assertThat(result.success()).isFalse();
    assertThat(result.reason()).startsWith("channel connection failed");
  }

  private Fixture newFixture() {
    final RestClient.Builder builder = RestClient.builder().baseUrl("http://channel.test");
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final NotificationWebhookProperties properties =
        new NotificationWebhookProperties("http://channel.test", "/messages", null, null);
    return new Fixture(new WebhookNotificationSender(builder.build(), properties), server);
  }

  private record Fixture(WebhookNotificationSender sender, MockRestServiceServer server) {}
}
