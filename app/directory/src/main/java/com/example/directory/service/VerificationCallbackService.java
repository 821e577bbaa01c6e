/*
 * どこで: Directory サービス層
 * 何を: OAuth コールバックで認可コードを交換し、アイデンティティを保存してロール付与とログ投稿を行う
 * なぜ: 認証済みユーザーのトークン対を後続の更新/招待処理で使えるようにするため
 */
package com.example.directory.service;

import com.example.directory.config.PlatformClientProperties;
import com.example.directory.model.DirectorySettings;
import com.example.directory.model.IdentityRecord;
import com.example.directory.repository.DirectorySettingsRepository;
import com.example.directory.repository.IdentityStore;
import com.example.directory.service.dto.PlatformUserResponse;
import com.example.directory.service.dto.TokenResponse;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class VerificationCallbackService {

  private static final Logger logger = LoggerFactory.getLogger(VerificationCallbackService.class);

  private final OAuthTokenClient tokenClient;
  private final PlatformUserClient userClient;
  private final GroupMembershipClient membershipClient;
  private final ChannelMessageClient channelMessageClient;
  private final IdentityStore identityStore;
  private final DirectorySettingsRepository settingsRepository;
  private final PlatformClientProperties platformProperties;
  private final DirectoryMetrics metrics;
  private final Clock clock;

  public IdentityRecord handleCallback(String code, String originAddress) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("code is required");
    }
    final TokenResponse token = exchange(code);
    final PlatformUserResponse user =
        userClient.fetchCurrentUser(token.authorizationScheme(), token.accessToken());
    final IdentityRecord record =
        new IdentityRecord(
            user.id(),
            displayName(user),
            token.accessToken(),
            token.hasRefreshToken() ? token.refreshToken() : null,
            originAddress,
            Instant.now(clock),
            user.avatar());
    identityStore.upsert(record);
    logger.info("identity verified identityId={} origin={}", record.id(), record.originAddress());
    metrics.recordVerificationResult("verified");

    grantVerifiedRole(record);
    postVerificationLog(user);
    return record;
  }

  /** {@code global_name} or {@code username} or the sentinel, plus {@code #discriminator}. */
  @VisibleForTesting
  static String displayName(PlatformUserResponse user) {
    final String name = baseName(user);
    final String discriminator = user.discriminator();
    if (discriminator != null && !discriminator.isBlank() && !"0".equals(discriminator)) {
      return name + "#" + discriminator;
    }
    return name;
  }

  private static String baseName(PlatformUserResponse user) {
    if (user.globalName() != null && !user.globalName().isBlank()) {
      return user.globalName().trim();
    }
    if (user.username() != null && !user.username().isBlank()) {
      return user.username().trim();
    }
    return IdentityRecord.UNKNOWN_DISPLAY_NAME;
  }

  private TokenResponse exchange(String code) {
    final TokenResponse token;
    try {
      token = tokenClient.exchangeCode(code);
    } catch (PlatformIntegrationException ex) {
      metrics.recordVerificationResult("exchange_failed");
      throw new VerificationFailedException("failed to verify authorization code", ex);
    }
    if (!token.hasAccessToken()) {
      metrics.recordVerificationResult("exchange_failed");
      logger.warn("authorization code exchange returned no access token");
      throw new VerificationFailedException("failed to verify authorization code");
    }
    return token;
  }

  private void grantVerifiedRole(IdentityRecord record) {
    if (!platformProperties.verifiedRoleConfigured()) {
      logger.debug("verified role grant skipped: home group or role not configured");
      return;
    }
    final String groupId = platformProperties.homeGroupId();
    logger.info("verified role grant attempted identityId={} groupId={}", record.id(), groupId);
    try {
      membershipClient.grantRole(groupId, record.id(), platformProperties.verifiedRoleId());
      logger.info("verified role granted identityId={} groupId={}", record.id(), groupId);
    } catch (PlatformIntegrationException ex) {
      if (ex.reason() == PlatformIntegrationException.Reason.NOT_FOUND) {
        logger.info(
            "verified role grant skipped: not a member identityId={} groupId={}",
            record.id(),
            groupId);
        return;
      }
      logger.warn(
          "verified role grant failed identityId={} groupId={} reason={}",
          record.id(),
          groupId,
          ex.reason());
    }
  }

  private void postVerificationLog(PlatformUserResponse user) {
    final DirectorySettings settings = settingsRepository.load();
    if (!settings.hasVerifiedLogChannel()) {
      return;
    }
    try {
      channelMessageClient.postMessage(
          settings.verifiedLogChannelId(), "✅ " + baseName(user) + " verified.");
    } catch (PlatformIntegrationException ex) {
      logger.warn(
          "verification log post failed channelId={} reason={}",
          settings.verifiedLogChannelId(),
          ex.reason());
    }
  }
}
