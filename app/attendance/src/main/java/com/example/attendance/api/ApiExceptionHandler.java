/*
 * どこで: Attendance API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 勤怠ルール違反と入力誤りを統一したエラー応答で返すため
 */
package com.example.attendance.api;

import com.example.attendance.service.AttendanceErrorCode;
import com.example.attendance.service.AttendanceRuleException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);
  static final String BAD_REQUEST = "BAD_REQUEST";

  @ExceptionHandler(AttendanceRuleException.class)
  public ResponseEntity<ApiErrorResponse> handleAttendanceRule(AttendanceRuleException ex) {
    final HttpStatus status = statusOf(ex.code());
    logger.info("attendance request rejected code={} message={}", ex.code(), ex.getMessage());
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse(ex.code().name(), ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return badRequest(ex.getParameterName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  static HttpStatus statusOf(AttendanceErrorCode code) {
    return switch (code) {
      case USER_NOT_FOUND, RECORD_NOT_FOUND -> HttpStatus.NOT_FOUND;
      case USER_INACTIVE, ROLE_NOT_TRACKED -> HttpStatus.FORBIDDEN;
      case INVALID_ORDERING, CONFLICTING_RECORD, SWEEP_TOO_EARLY,
          DUPLICATE_LOGIN, DUPLICATE_LOGOUT -> HttpStatus.CONFLICT;
      case PAST_DATE -> HttpStatus.BAD_REQUEST;
    };
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
