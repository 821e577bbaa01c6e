/*
 * どこで: Directory サービス層
 * 何を: 全アイデンティティのトークン対を更新し、更新不能なものを削除する
 * なぜ: 一括招待などで使うアクセストークンを常に有効な状態に保つため
 */
package com.example.directory.service;

import com.example.directory.model.IdentityRecord;
import com.example.directory.model.RefreshSummary;
import com.example.directory.repository.IdentityStore;
import com.example.directory.service.dto.TokenResponse;
import java.util.Iterator;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CredentialRefreshService {

  private static final Logger logger = LoggerFactory.getLogger(CredentialRefreshService.class);

  private final IdentityStore identityStore;
  private final OAuthTokenClient tokenClient;
  private final DirectoryMetrics metrics;

  /**
   * Refreshes every stored identity once and saves the result in a single write.
   *
   * <p>Records without a refresh token, records whose refresh yields no access token and records
   * whose refresh call fails are evicted. A refresh that returns no new refresh token keeps the
   * existing one.
   */
  public RefreshSummary refreshAll() {
    final Map<String, IdentityRecord> identities = identityStore.load();
    if (identities.isEmpty()) {
      logger.info("credential refresh skipped: directory is empty");
      return new RefreshSummary(0, 0);
    }
    int refreshed = 0;
    int deleted = 0;
    final Iterator<Map.Entry<String, IdentityRecord>> iterator = identities.entrySet().iterator();
    while (iterator.hasNext()) {
      final Map.Entry<String, IdentityRecord> entry = iterator.next();
      final IdentityRecord rotated = refreshOne(entry.getValue());
      if (rotated == null) {
        iterator.remove();
        deleted++;
        metrics.recordRefreshResult("deleted");
        continue;
      }
      entry.setValue(rotated);
      refreshed++;
      metrics.recordRefreshResult("refreshed");
    }
    identityStore.save(identities);
    logger.info("credential refresh completed refreshed={} deleted={}", refreshed, deleted);
    return new RefreshSummary(refreshed, deleted);
  }

  /** Returns the rotated record, or {@code null} when the record must be evicted. */
  private IdentityRecord refreshOne(IdentityRecord record) {
    if (!record.hasRefreshToken()) {
      logger.info("credential evicted: no refresh token identityId={}", record.id());
      return null;
    }
    final TokenResponse response;
    try {
      response = tokenClient.refresh(record.refreshToken());
    } catch (RuntimeException ex) {
      logger.warn(
          "credential evicted: refresh failed identityId={} cause={}",
          record.id(),
          ex.getMessage());
      return null;
    }
    if (!response.hasAccessToken()) {
      logger.info("credential evicted: refresh returned no access token identityId={}", record.id());
      return null;
    }
    final String refreshToken =
        response.hasRefreshToken() ? response.refreshToken() : record.refreshToken();
    return record.withTokens(response.accessToken(), refreshToken);
  }
}
