/*
 * どこで: Notification サービス層
 * 何を: 配信チャネル 1 回分の送信結果
 * なぜ: 成功以外をすべて終端の失敗として扱い、理由を監査ログへ残すため
 */
package com.example.attendance.service;

public record DeliveryResult(boolean success, String reason) {

  public static DeliveryResult ok() {
    return new DeliveryResult(true, null);
  }

  public static DeliveryResult failure(String reason) {
    return new DeliveryResult(false, reason);
  }
}
