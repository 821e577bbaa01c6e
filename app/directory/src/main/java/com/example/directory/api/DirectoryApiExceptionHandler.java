/*
 * どこで: app/directory/src/main/java/com/example/directory/api/DirectoryApiExceptionHandler.java
 * 何を: Directory API の例外を標準エラー形式へ変換する
 * なぜ: 検証/認可/外部連携/永続化の失敗を一定の code と HTTP ステータスで返すため
 */
package com.example.directory.api;

import com.example.directory.repository.DirectoryStoreException;
import com.example.directory.service.IdentityNotFoundException;
import com.example.directory.service.PageTokenException;
import com.example.directory.service.PlatformIntegrationException;
import com.example.directory.service.UploadRejectedException;
import com.example.directory.service.VerificationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class DirectoryApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(DirectoryApiExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("DIRECTORY_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("DIRECTORY_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(VerificationFailedException.class)
  public ResponseEntity<ApiErrorResponse> handleVerificationFailed(
      VerificationFailedException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("VERIFICATION_FAILED", ex.getMessage()));
  }

  @ExceptionHandler(IdentityNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(IdentityNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("IDENTITY_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(UploadRejectedException.class)
  public ResponseEntity<ApiErrorResponse> handleUploadRejected(UploadRejectedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("UPLOAD_FORBIDDEN", ex.getMessage()));
  }

  @ExceptionHandler(PageTokenException.class)
  public ResponseEntity<ApiErrorResponse> handlePageToken(PageTokenException ex) {
    final HttpStatus status =
        switch (ex.reason()) {
          case EXPIRED -> HttpStatus.GONE;
          case FORBIDDEN -> HttpStatus.FORBIDDEN;
          case MALFORMED -> HttpStatus.BAD_REQUEST;
        };
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse("PAGE_TOKEN_" + ex.reason().name(), ex.getMessage()));
  }

  @ExceptionHandler(PlatformIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handlePlatformIntegration(
      PlatformIntegrationException ex) {
    final HttpStatus status =
        switch (ex.reason()) {
          case NOT_FOUND -> HttpStatus.NOT_FOUND;
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case UNAUTHORIZED, FORBIDDEN, RATE_LIMITED, REJECTED, BAD_GATEWAY, INVALID_RESPONSE ->
              HttpStatus.BAD_GATEWAY;
        };
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse("PLATFORM_" + ex.reason().name(), ex.getMessage()));
  }

  @ExceptionHandler(DirectoryStoreException.class)
  public ResponseEntity<ApiErrorResponse> handleStore(DirectoryStoreException ex) {
    logger.error("directory store operation failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("DIRECTORY_STORE_ERROR", ex.getMessage()));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalState(IllegalStateException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("DIRECTORY_NOT_CONFIGURED", ex.getMessage()));
  }
}
