/*
 * どこで: Directory サービス層
 * 何を: 認可コード交換とリフレッシュトークン更新を呼び出す
 * なぜ: トークンエンドポイントの失敗を共通の理由に揃えて扱うため
 */
package com.example.directory.service;

import com.example.directory.config.PlatformClientProperties;
import com.example.directory.service.dto.TokenResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

/** Platform OAuth2 token endpoint: authorization-code exchange and refresh-token rotation. */
@Service
@RequiredArgsConstructor
public class OAuthTokenClient {

  private static final String TOKEN_PATH = "/oauth2/token";

  private final RestClient platformRestClient;
  private final PlatformClientProperties properties;

  public TokenResponse exchangeCode(String code) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("code is required");
    }
    final MultiValueMap<String, String> form = clientCredentials();
    form.add("grant_type", "authorization_code");
    form.add("code", code);
    form.add("redirect_uri", properties.redirectUri());
    return requestToken("token exchange", form);
  }

  public TokenResponse refresh(String refreshToken) {
    if (refreshToken == null || refreshToken.isBlank()) {
      throw new IllegalArgumentException("refresh token is required");
    }
    final MultiValueMap<String, String> form = clientCredentials();
    form.add("grant_type", "refresh_token");
    form.add("refresh_token", refreshToken);
    return requestToken("token refresh", form);
  }

  private MultiValueMap<String, String> clientCredentials() {
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("client_id", properties.clientId());
    form.add("client_secret", properties.clientSecret());
    return form;
  }

  private TokenResponse requestToken(String operation, MultiValueMap<String, String> form) {
    try {
      final TokenResponse response =
          platformRestClient
              .post()
              .uri(TOKEN_PATH)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .body(TokenResponse.class);
      if (response == null) {
        throw new PlatformIntegrationException(
            PlatformIntegrationException.Reason.INVALID_RESPONSE,
            "platform " + operation + " returned empty body");
      }
      return response;
    } catch (RuntimeException ex) {
      throw PlatformErrorTranslator.translate(operation, ex);
    }
  }
}
