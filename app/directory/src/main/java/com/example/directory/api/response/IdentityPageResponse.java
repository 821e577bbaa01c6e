/*
 * どこで: app/directory/src/main/java/com/example/directory/api/response/IdentityPageResponse.java
 * 何を: 一覧 1 ページ分と前後ページ送りトークンの出力 DTO
 * なぜ: トークンが null のボタンを無効表示にする描画側の契約を固定するため
 */
package com.example.directory.api.response;

import com.example.directory.model.IdentityPageView;
import java.util.List;

public record IdentityPageResponse(
    int page,
    int pageCount,
    int total,
    List<IdentitySummaryResponse> entries,
    String previousToken,
    String nextToken) {

  public static IdentityPageResponse from(IdentityPageView view) {
    return new IdentityPageResponse(
        view.page(),
        view.pageCount(),
        view.total(),
        view.entries().stream().map(IdentitySummaryResponse::from).toList(),
        view.previousToken(),
        view.nextToken());
  }
}
