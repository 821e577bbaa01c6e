/*
 * どこで: Directory サービス層
 * 何を: アクセストークンで現在ユーザーを取得/検証する
 * なぜ: 認証コールバックと無効トークン掃除で同じ呼び出しを共有するため
 */
package com.example.directory.service;

import com.example.directory.service.dto.PlatformUserResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class PlatformUserClient {

  private static final Logger logger = LoggerFactory.getLogger(PlatformUserClient.class);
  private static final String CURRENT_USER_PATH = "/users/@me";

  private final RestClient platformRestClient;

  public PlatformUserResponse fetchCurrentUser(String tokenType, String accessToken) {
    final PlatformUserResponse response;
    try {
      response =
          platformRestClient
              .get()
              .uri(CURRENT_USER_PATH)
              .header(HttpHeaders.AUTHORIZATION, tokenType + " " + accessToken)
              .retrieve()
              .body(PlatformUserResponse.class);
    } catch (RuntimeException ex) {
      throw PlatformErrorTranslator.translate("current user lookup", ex);
    }
    if (response == null || response.id() == null || response.id().isBlank()) {
      logger.warn("platform current user response validation failed");
      throw new PlatformIntegrationException(
          PlatformIntegrationException.Reason.INVALID_RESPONSE, "platform user response is invalid");
    }
    return response;
  }

  /**
   * Checks the current-user endpoint with {@code accessToken}. Any non-2xx answer means the token
   * is no longer usable; transport failures propagate.
   */
  public boolean isAccessTokenAccepted(String accessToken) {
    try {
      platformRestClient
          .get()
          .uri(CURRENT_USER_PATH)
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
          .retrieve()
          .toBodilessEntity();
      return true;
    } catch (RestClientResponseException ex) {
      logger.debug("platform rejected access token status={}", ex.getStatusCode().value());
      return false;
    } catch (RuntimeException ex) {
      throw PlatformErrorTranslator.translate("token check", ex);
    }
  }
}
