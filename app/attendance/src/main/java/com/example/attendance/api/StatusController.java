/*
 * どこで: Attendance API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: ロードバランサからの疎通確認を軽量に返すため
 */
package com.example.attendance.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "attendance: ok";
  }
}
