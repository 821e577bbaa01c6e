/*
 * どこで: Directory サービス層
 * 何を: プラットフォームの認可 URL を組み立てる
 * なぜ: 利用者に配布する認証リンクを設定値だけから生成するため
 */
package com.example.directory.service;

import com.example.directory.config.PlatformClientProperties;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuthorizeLinkService {

  private final PlatformClientProperties properties;

  public String verificationLink() {
    if (properties.clientId().isBlank() || properties.redirectUri().isBlank()) {
      throw new IllegalStateException("platform client id and redirect uri must be configured");
    }
    return properties.authorizeUrl()
        + "?response_type=code"
        + "&client_id="
        + encode(properties.clientId())
        + "&redirect_uri="
        + encode(properties.redirectUri())
        + "&scope="
        + encode(properties.scope());
  }

  private String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
