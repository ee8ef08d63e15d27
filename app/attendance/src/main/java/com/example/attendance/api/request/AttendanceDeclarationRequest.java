/*
 * どこで: Attendance API リクエスト DTO
 * 何を: 休暇/在宅申告 API の入力を定義する
 * なぜ: 対象日と備考を型安全に受け取るため
 */
package com.example.attendance.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendanceDeclarationRequest(
    @NotBlank(message = "user_id is required") String userId,
    @NotNull(message = "date is required") LocalDate date,
    @Size(max = 500, message = "notes must be at most 500 characters") String notes) {}
