/*
 * どこで: Attendance API リクエスト DTO
 * 何を: ログイン/ログアウト API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.attendance.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendanceEventRequest(@NotBlank(message = "user_id is required") String userId) {}
