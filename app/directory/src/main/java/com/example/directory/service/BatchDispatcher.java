/*
 * どこで: Directory サービス層
 * 何を: アイデンティティ列を固定サイズのバッチに分け、バッチ内は並行にメンバー追加を行う
 * なぜ: 外部 API のレート制限を超えずに大量招待を進め、1 件の失敗で全体を止めないため
 */
package com.example.directory.service;

import com.example.directory.model.DispatchResult;
import com.example.directory.model.IdentityRecord;
import com.google.common.collect.Lists;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BatchDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(BatchDispatcher.class);

  private final GroupMembershipClient membershipClient;
  private final ExecutorService directoryDispatchExecutor;
  private final DispatchPacer pacer;
  private final DirectoryMetrics metrics;

  /**
   * Adds every record to {@code groupId}. Batch N+1 starts only after every call of batch N has
   * settled; {@code interBatchDelay} is applied between batches but not after the last one.
   */
  public DispatchResult dispatch(
      List<IdentityRecord> records, String groupId, int batchSize, Duration interBatchDelay) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1");
    }
    if (records == null || records.isEmpty()) {
      return DispatchResult.empty();
    }
    final List<List<IdentityRecord>> batches = Lists.partition(records, batchSize);
    int success = 0;
    int failed = 0;
    for (int index = 0; index < batches.size(); index++) {
      final List<IdentityRecord> batch = batches.get(index);
      final List<CompletableFuture<Boolean>> calls = new ArrayList<>(batch.size());
      for (IdentityRecord record : batch) {
        if (!record.hasAccessToken()) {
          logger.warn("invite skipped: no access token identityId={}", record.id());
          calls.add(CompletableFuture.completedFuture(false));
          continue;
        }
        calls.add(
            CompletableFuture.supplyAsync(() -> invite(record, groupId), directoryDispatchExecutor));
      }
      CompletableFuture.allOf(calls.toArray(new CompletableFuture<?>[0])).join();
      for (CompletableFuture<Boolean> call : calls) {
        if (call.join()) {
          success++;
          metrics.recordInviteResult("success");
        } else {
          failed++;
          metrics.recordInviteResult("failed");
        }
      }
      logger.info(
          "invite batch settled groupId={} batch={}/{} size={}",
          groupId,
          index + 1,
          batches.size(),
          batch.size());
      if (index < batches.size() - 1) {
        pacer.pause(interBatchDelay);
      }
    }
    logger.info("invite dispatch completed groupId={} success={} failed={}", groupId, success, failed);
    return new DispatchResult(success, failed);
  }

  private boolean invite(IdentityRecord record, String groupId) {
    try {
      membershipClient.addMember(groupId, record.id(), record.accessToken());
      return true;
    } catch (RuntimeException ex) {
      logger.warn(
          "invite failed identityId={} groupId={} cause={}", record.id(), groupId, ex.getMessage());
      return false;
    }
  }
}
