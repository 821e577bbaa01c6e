/*
 * どこで: Directory アプリの設定バインド
 * 何を: 一括招待のバッチサイズとバッチ間待機時間を保持する
 * なぜ: 外部 API のレート制限に合わせて運用で調整し、起動時に妥当性を検証するため
 */
package com.example.directory.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "directory.invite")
@Validated
public record InviteProperties(@Positive int batchSize, @NotNull Duration interBatchDelay) {

  @AssertTrue(message = "directory.invite.inter-batch-delay must not be negative")
  public boolean isInterBatchDelayNonNegative() {
    // 0 は「待機なし」として許容する。null は @NotNull で検出する。
    return interBatchDelay == null || !interBatchDelay.isNegative();
  }
}
