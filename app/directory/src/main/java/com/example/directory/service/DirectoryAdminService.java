/*
 * どこで: Directory サービス層
 * 何を: オペレーター向けの参照/削除/無効トークン掃除/設定変更をまとめる
 * なぜ: 管理操作のストア更新とログ出力を 1 か所に集約するため
 */
package com.example.directory.service;

import com.example.directory.model.CleanupSummary;
import com.example.directory.model.DirectorySettings;
import com.example.directory.model.IdentityRecord;
import com.example.directory.model.OriginGroup;
import com.example.directory.repository.DirectorySettingsRepository;
import com.example.directory.repository.IdentityStore;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Operator maintenance of the directory: lookup, duplicate origins, removal and cleanup. */
@Service
@RequiredArgsConstructor
public class DirectoryAdminService {

  private static final Logger logger = LoggerFactory.getLogger(DirectoryAdminService.class);

  private final IdentityStore identityStore;
  private final DirectorySettingsRepository settingsRepository;
  private final PlatformUserClient userClient;

  public IdentityRecord find(String identityId) {
    return identityStore
        .find(identityId)
        .orElseThrow(() -> new IdentityNotFoundException(identityId));
  }

  /** Origins shared by more than one identity, in first-seen order. */
  public List<OriginGroup> sharedOrigins() {
    final ImmutableListMultimap<String, IdentityRecord> byOrigin =
        Multimaps.index(identityStore.load().values(), IdentityRecord::originAddress);
    return byOrigin.asMap().entrySet().stream()
        .filter(entry -> entry.getValue().size() > 1)
        .map(entry -> new OriginGroup(entry.getKey(), List.copyOf(entry.getValue())))
        .toList();
  }

  public void remove(String identityId) {
    if (!identityStore.remove(identityId)) {
      throw new IdentityNotFoundException(identityId);
    }
    logger.info("identity removed identityId={}", identityId);
  }

  public int removeAll() {
    final int count = identityStore.load().size();
    identityStore.clear();
    logger.info("directory cleared removed={}", count);
    return count;
  }

  /**
   * Removes identities whose access token is missing or no longer accepted by the platform. The
   * store is saved once at the end of the sweep.
   */
  public CleanupSummary cleanupInvalidTokens() {
    final Map<String, IdentityRecord> identities = identityStore.load();
    final int checked = identities.size();
    int removed = 0;
    final Iterator<IdentityRecord> iterator = identities.values().iterator();
    while (iterator.hasNext()) {
      final IdentityRecord record = iterator.next();
      if (!hasUsableToken(record)) {
        iterator.remove();
        removed++;
      }
    }
    identityStore.save(identities);
    logger.info("token cleanup completed checked={} removed={}", checked, removed);
    return new CleanupSummary(checked, removed);
  }

  public DirectorySettings setVerifiedLogChannel(String channelId) {
    if (channelId == null || channelId.isBlank()) {
      throw new IllegalArgumentException("channelId is required");
    }
    final DirectorySettings updated =
        settingsRepository.load().withVerifiedLogChannel(channelId.trim());
    settingsRepository.save(updated);
    logger.info("verified log channel set channelId={}", updated.verifiedLogChannelId());
    return updated;
  }

  private boolean hasUsableToken(IdentityRecord record) {
    if (!record.hasAccessToken()) {
      logger.info("token cleanup removed identityId={} cause=no_access_token", record.id());
      return false;
    }
    try {
      if (userClient.isAccessTokenAccepted(record.accessToken())) {
        return true;
      }
      logger.info("token cleanup removed identityId={} cause=rejected", record.id());
    } catch (RuntimeException ex) {
      logger.warn(
          "token cleanup removed identityId={} cause=token_check_failed message={}",
          record.id(),
          ex.getMessage());
    }
    return false;
  }
}
