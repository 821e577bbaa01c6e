/*
 * どこで: Directory サービス層
 * 何を: 全件招待と個別招待の入口
 * なぜ: 全件招待の前にトークンを更新し、失効したアイデンティティを招待対象から外すため
 */
package com.example.directory.service;

import com.example.directory.config.InviteProperties;
import com.example.directory.model.DispatchResult;
import com.example.directory.model.IdentityRecord;
import com.example.directory.model.RefreshSummary;
import com.example.directory.repository.IdentityStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class InviteService {

  private static final Logger logger = LoggerFactory.getLogger(InviteService.class);

  private final IdentityStore identityStore;
  private final CredentialRefreshService refreshService;
  private final BatchDispatcher dispatcher;
  private final GroupMembershipClient membershipClient;
  private final InviteProperties properties;

  /** Refreshes all credentials, then invites every surviving identity to {@code groupId}. */
  public DispatchResult inviteAll(String groupId) {
    requireGroupId(groupId);
    if (identityStore.load().isEmpty()) {
      logger.info("invite-all skipped: directory is empty groupId={}", groupId);
      return DispatchResult.empty();
    }
    final RefreshSummary refresh = refreshService.refreshAll();
    logger.info(
        "invite-all pre-refresh refreshed={} deleted={}", refresh.refreshed(), refresh.deleted());
    final List<IdentityRecord> records = List.copyOf(identityStore.load().values());
    return dispatcher.dispatch(
        records, groupId, properties.batchSize(), properties.interBatchDelay());
  }

  public void inviteOne(String groupId, String identityId) {
    requireGroupId(groupId);
    final IdentityRecord record =
        identityStore
            .find(identityId)
            .filter(IdentityRecord::hasAccessToken)
            .orElseThrow(() -> new IdentityNotFoundException(identityId));
    membershipClient.addMember(groupId, record.id(), record.accessToken());
    logger.info("invite completed identityId={} groupId={}", record.id(), groupId);
  }

  private static void requireGroupId(String groupId) {
    if (groupId == null || groupId.isBlank()) {
      throw new IllegalArgumentException("groupId is required");
    }
  }
}
