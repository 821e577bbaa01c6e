/*
 * どこで: Directory アプリの設定バインド
 * 何を: 一覧のページサイズとページ送りトークンの TTL/署名鍵を保持する
 * なぜ: ボタンの有効期限と改ざん検知鍵を環境ごとに設定できるようにするため
 */
package com.example.directory.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "directory.pagination")
@Validated
public record PaginationProperties(
    @Positive int pageSize, @NotNull Duration tokenTtl, String signingSecret) {

  public PaginationProperties {
    signingSecret = signingSecret == null ? "" : signingSecret;
  }

  @AssertTrue(message = "directory.pagination.token-ttl must be positive")
  public boolean isTokenTtlPositive() {
    return tokenTtl == null || (!tokenTtl.isZero() && !tokenTtl.isNegative());
  }
}
