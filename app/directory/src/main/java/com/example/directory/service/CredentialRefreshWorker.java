/*
 * どこで: Directory ワーカー
 * 何を: トークン更新パスを定期実行する
 * なぜ: オペレーター操作がなくてもトークン期限切れ前に更新するため
 */
package com.example.directory.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "directory.refresh.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class CredentialRefreshWorker {

  private final CredentialRefreshService refreshService;

  @Scheduled(
      fixedDelayString = "${directory.refresh.interval:PT5H}",
      initialDelayString = "${directory.refresh.initial-delay:PT1M}")
  public void run() {
    refreshService.refreshAll();
  }
}
