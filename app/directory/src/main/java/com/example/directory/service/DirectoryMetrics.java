/*
 * どこで: Directory サービス層
 * 何を: トークン更新/一括招待/認証コールバック/ページトークン拒否/ストア失敗のメトリクスを記録する
 * なぜ: 外部 API 失敗やファイル書き込み失敗の増加を Prometheus から直接観測できるようにするため
 */
package com.example.directory.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DirectoryMetrics {

  private static final String METRIC_REFRESH_TOTAL = "directory.refresh.total";
  private static final String METRIC_INVITE_TOTAL = "directory.invite.total";
  private static final String METRIC_VERIFICATION_TOTAL = "directory.verification.total";
  private static final String METRIC_PAGE_TOKEN_REJECTED_TOTAL =
      "directory.page_token.rejected.total";
  private static final String METRIC_STORE_ERROR_TOTAL = "directory.store.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public DirectoryMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordRefreshResult(String result) {
    increment(METRIC_REFRESH_TOTAL, "Credential refresh outcomes per identity", "result", result);
  }

  public void recordInviteResult(String result) {
    increment(METRIC_INVITE_TOTAL, "Group invitation outcomes per identity", "result", result);
  }

  public void recordVerificationResult(String result) {
    increment(METRIC_VERIFICATION_TOTAL, "Authorization callback outcomes", "result", result);
  }

  public void recordPageTokenRejected(String reason) {
    increment(
        METRIC_PAGE_TOKEN_REJECTED_TOTAL, "Rejected pagination token redemptions", "reason", reason);
  }

  public void recordStoreError(String operation) {
    increment(
        METRIC_STORE_ERROR_TOTAL, "Directory file read/write failures", "operation", operation);
  }

  private void increment(String name, String description, String tagKey, String tagValue) {
    counters
        .computeIfAbsent(
            name + "|" + tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
