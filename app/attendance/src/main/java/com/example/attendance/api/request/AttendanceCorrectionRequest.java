/*
 * どこで: Attendance 管理 API リクエスト DTO
 * 何を: 勤怠レコード修正 API の入力を定義する
 * なぜ: 上書き対象の項目を明示して受け取るため
 */
package com.example.attendance.api.request;

import com.example.attendance.model.AttendanceStatus;
import com.example.attendance.model.WorkType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

// 未指定の項目は既存値を残す
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendanceCorrectionRequest(
    AttendanceStatus status,
    WorkType workType,
    @Size(max = 500, message = "notes must be at most 500 characters") String notes) {}
