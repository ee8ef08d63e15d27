/*
 * どこで: Attendance 設定
 * 何を: 外部配信チャネル呼び出し専用の RestClient を提供する
 * なぜ: 配信チャネル自身の呼び出しタイムアウトを接続単位で固定するため
 */
package com.example.attendance.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "notification.channel", havingValue = "webhook")
public class NotificationWebhookConfig {

  @Bean
  RestClient notificationRestClient(
      RestClient.Builder builder, NotificationWebhookProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
