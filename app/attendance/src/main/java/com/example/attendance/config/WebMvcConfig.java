/*
 * どこで: Attendance Web 設定
 * 何を: RequestMdcInterceptor を API パスへ適用する
 * なぜ: 勤怠/通知 API のログへリクエスト ID とユーザ ID を載せるため
 */
package com.example.attendance.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  static final String API_PATH_PATTERN = "/v1/**";

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // ルートの疎通確認はログ対象外。
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(API_PATH_PATTERN);
  }
}
