/*
 * どこで: Directory 設定バインド
 * 何を: プラットフォーム API の接続先/クライアント資格情報/タイムアウト
 * なぜ: 環境変数から接続設定を切り替え、無期限待ちを防ぐため
 */
package com.example.directory.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "platform")
public record PlatformClientProperties(
    String baseUrl,
    String authorizeUrl,
    String clientId,
    String clientSecret,
    String redirectUri,
    String scope,
    String botToken,
    String homeGroupId,
    String verifiedRoleId,
    Duration connectTimeout,
    Duration readTimeout) {

  private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(10);

  public PlatformClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://discord.com/api" : baseUrl;
    authorizeUrl =
        authorizeUrl == null || authorizeUrl.isBlank()
            ? "https://discord.com/oauth2/authorize"
            : authorizeUrl;
    clientId = clientId == null ? "" : clientId;
    clientSecret = clientSecret == null ? "" : clientSecret;
    redirectUri = redirectUri == null ? "" : redirectUri;
    scope = scope == null || scope.isBlank() ? "identify guilds.join" : scope;
    botToken = botToken == null ? "" : botToken;
    homeGroupId = homeGroupId == null ? "" : homeGroupId;
    verifiedRoleId = verifiedRoleId == null ? "" : verifiedRoleId;
    // 無期限待ちはバッチ全体を止めるため、未設定や 0 以下は既定値に戻す
    connectTimeout = positiveOr(connectTimeout, DEFAULT_CONNECT_TIMEOUT);
    readTimeout = positiveOr(readTimeout, DEFAULT_READ_TIMEOUT);
  }

  public boolean verifiedRoleConfigured() {
    return !homeGroupId.isBlank() && !verifiedRoleId.isBlank();
  }

  private static Duration positiveOr(Duration value, Duration fallback) {
    return value == null || value.isZero() || value.isNegative() ? fallback : value;
  }
}
