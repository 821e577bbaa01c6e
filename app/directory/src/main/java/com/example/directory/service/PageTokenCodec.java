/*
 * どこで: Directory サービス層
 * 何を: 一覧ページ送りトークンのエンコード/デコード/検証を行う
 * なぜ: サーバー側に状態を持たずに、所有者・有効期限・改ざんを検証するため
 */
package com.example.directory.service;

import com.example.directory.config.PaginationProperties;
import com.example.directory.model.PageAction;
import com.example.directory.model.PageToken;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Wire format: {@code <action>:<page>:<actorId>:<issuedAtEpochMillis>:<tag>}, where {@code tag} is
 * the first 16 bytes of HMAC-SHA256 over the four leading fields, base64url without padding.
 */
@Component
public class PageTokenCodec {

  private static final Logger logger = LoggerFactory.getLogger(PageTokenCodec.class);
  private static final char SEPARATOR = ':';
  private static final Splitter SPLITTER = Splitter.on(SEPARATOR);
  private static final BaseEncoding TAG_ENCODING = BaseEncoding.base64Url().omitPadding();
  private static final int TAG_BYTES = 16;
  private static final int KEY_BYTES = 32;
  private static final int FIELD_COUNT = 5;

  private final HashFunction mac;
  private final Duration ttl;

  @Autowired
  public PageTokenCodec(PaginationProperties properties) {
    this(signingKey(properties.signingSecret()), properties.tokenTtl());
  }

  @VisibleForTesting
  PageTokenCodec(byte[] signingKey, Duration ttl) {
    this.mac = Hashing.hmacSha256(signingKey);
    this.ttl = ttl;
  }

  public Duration ttl() {
    return ttl;
  }

  public String encode(PageToken token) {
    if (token.actorId().indexOf(SEPARATOR) >= 0) {
      throw new IllegalArgumentException("actorId must not contain '" + SEPARATOR + "'");
    }
    final String payload =
        token.action().value()
            + SEPARATOR
            + token.targetPage()
            + SEPARATOR
            + token.actorId()
            + SEPARATOR
            + token.issuedAt().toEpochMilli();
    return payload + SEPARATOR + tag(payload);
  }

  public PageToken decode(String encoded) {
    if (encoded == null || encoded.isBlank()) {
      throw malformed("empty token");
    }
    final List<String> fields = SPLITTER.splitToList(encoded);
    if (fields.size() != FIELD_COUNT) {
      throw malformed("unexpected field count");
    }
    final String payload = encoded.substring(0, encoded.lastIndexOf(SEPARATOR));
    if (!tagMatches(payload, fields.get(4))) {
      throw malformed("tag mismatch");
    }
    final Optional<PageAction> action = PageAction.fromValue(fields.get(0));
    if (action.isEmpty()) {
      throw malformed("unknown action");
    }
    try {
      final int page = Integer.parseInt(fields.get(1));
      final Instant issuedAt = Instant.ofEpochMilli(Long.parseLong(fields.get(3)));
      return new PageToken(action.get(), page, fields.get(2), issuedAt);
    } catch (IllegalArgumentException ex) {
      throw malformed("invalid field: " + ex.getMessage());
    }
  }

  /**
   * Decodes {@code encoded} and checks it for {@code redeemerId} at {@code now}. Expiry is checked
   * before ownership, so an expired token is reported as expired whoever presents it.
   */
  public PageToken redeem(String encoded, String redeemerId, Instant now) {
    final PageToken token = decode(encoded);
    if (Duration.between(token.issuedAt(), now).compareTo(ttl) > 0) {
      throw new PageTokenException(
          PageTokenException.Reason.EXPIRED, "This pagination has expired.");
    }
    if (redeemerId == null || !token.actorId().equals(redeemerId.trim())) {
      throw new PageTokenException(PageTokenException.Reason.FORBIDDEN, "not permitted");
    }
    return token;
  }

  private String tag(String payload) {
    final byte[] digest = mac.hashString(payload, StandardCharsets.UTF_8).asBytes();
    return TAG_ENCODING.encode(Arrays.copyOf(digest, TAG_BYTES));
  }

  private boolean tagMatches(String payload, String presentedTag) {
    return MessageDigest.isEqual(
        tag(payload).getBytes(StandardCharsets.US_ASCII),
        presentedTag.getBytes(StandardCharsets.US_ASCII));
  }

  private static PageTokenException malformed(String detail) {
    logger.debug("page token rejected as malformed detail={}", detail);
    return new PageTokenException(PageTokenException.Reason.MALFORMED, "malformed page token");
  }

  private static byte[] signingKey(String secret) {
    if (secret != null && !secret.isBlank()) {
      return secret.getBytes(StandardCharsets.UTF_8);
    }
    logger.info("pagination signing secret not configured; using a per-process random key");
    final byte[] key = new byte[KEY_BYTES];
    new SecureRandom().nextBytes(key);
    return key;
  }
}
