/*
 * どこで: Notification サービス層
 * 何を: 外部配信チャネルの抽象化インターフェース
 * なぜ: 実送信/テスト差し替えを容易にするため
 */
package com.example.attendance.service;

public interface NotificationSender {

  /** 1 回だけ送信を試みる。チャネル側のタイムアウトや拒否は failure として返してよい。 */
  DeliveryResult send(String address, String message);
}
