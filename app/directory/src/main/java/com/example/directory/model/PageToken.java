/*
 * どこで: app/directory/src/main/java/com/example/directory/model/PageToken.java
 * 何を: 一覧ページ送りボタンが運ぶ「誰が・いつ・どのページへ」の情報
 * なぜ: サーバー側セッションなしで所有者と有効期限を検証するため
 */
package com.example.directory.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

public record PageToken(PageAction action, int targetPage, String actorId, Instant issuedAt) {

  public PageToken {
    Objects.requireNonNull(action, "action is required");
    Objects.requireNonNull(issuedAt, "issuedAt is required");
    if (actorId == null || actorId.isBlank()) {
      throw new IllegalArgumentException("actorId is required");
    }
    // ワイヤ形式はミリ秒精度のため、発行時点で揃えておく
    issuedAt = issuedAt.truncatedTo(ChronoUnit.MILLIS);
  }
}
