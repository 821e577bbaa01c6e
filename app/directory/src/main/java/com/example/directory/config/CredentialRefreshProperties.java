/*
 * どこで: Directory 設定バインド
 * 何を: 定期トークン更新の実行間隔と初回遅延
 * なぜ: 起動直後にトークン API 呼び出しが集中しないようにするため
 */
package com.example.directory.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "directory.refresh")
public record CredentialRefreshProperties(
    boolean enabled, Duration interval, Duration initialDelay) {}
