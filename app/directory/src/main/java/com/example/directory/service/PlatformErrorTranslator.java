/*
 * どこで: Directory サービス層
 * 何を: RestClient の失敗を PlatformIntegrationException の理由に変換する
 * なぜ: 全プラットフォームクライアントで同じ失敗分類を使うため
 */
package com.example.directory.service;

import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

final class PlatformErrorTranslator {

  private static final Logger logger = LoggerFactory.getLogger(PlatformErrorTranslator.class);

  private PlatformErrorTranslator() {}

  static PlatformIntegrationException translate(String operation, RuntimeException ex) {
    if (ex instanceof PlatformIntegrationException integration) {
      return integration;
    }
    if (ex instanceof RestClientResponseException response) {
      final int status = response.getStatusCode().value();
      logger.warn(
          "platform {} failed with http status={} statusText={}",
          operation,
          status,
          response.getStatusText());
      return new PlatformIntegrationException(
          reasonFor(response), "platform " + operation + " failed with status " + status, ex);
    }
    if (ex instanceof ResourceAccessException access) {
      if (isTimeout(access)) {
        logger.warn("platform {} timed out", operation);
        return new PlatformIntegrationException(
            PlatformIntegrationException.Reason.TIMEOUT, "platform " + operation + " timeout", ex);
      }
      logger.warn("platform {} connection failed", operation, ex);
      return new PlatformIntegrationException(
          PlatformIntegrationException.Reason.BAD_GATEWAY,
          "platform " + operation + " connection failed",
          ex);
    }
    logger.warn("platform {} response parse failed", operation, ex);
    return new PlatformIntegrationException(
        PlatformIntegrationException.Reason.INVALID_RESPONSE,
        "platform " + operation + " response parse failed",
        ex);
  }

  private static PlatformIntegrationException.Reason reasonFor(
      RestClientResponseException response) {
    final int status = response.getStatusCode().value();
    if (status == 401) {
      return PlatformIntegrationException.Reason.UNAUTHORIZED;
    }
    if (status == 403) {
      return PlatformIntegrationException.Reason.FORBIDDEN;
    }
    if (status == 404) {
      return PlatformIntegrationException.Reason.NOT_FOUND;
    }
    if (status == 429) {
      return PlatformIntegrationException.Reason.RATE_LIMITED;
    }
    if (response.getStatusCode().is5xxServerError()) {
      return PlatformIntegrationException.Reason.BAD_GATEWAY;
    }
    return PlatformIntegrationException.Reason.REJECTED;
  }

  private static boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
