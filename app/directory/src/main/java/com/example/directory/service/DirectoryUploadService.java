/*
 * どこで: Directory サービス層
 * 何を: アップロードされた JSON ドキュメントで users.json を丸ごと置き換える
 * なぜ: ホストにログインせずにディレクトリの復元や移行を行えるようにするため
 */
package com.example.directory.service;

import com.example.directory.config.UploadProperties;
import com.example.directory.repository.IdentityStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DirectoryUploadService {

  private static final Logger logger = LoggerFactory.getLogger(DirectoryUploadService.class);

  private final IdentityStore identityStore;
  private final UploadProperties properties;
  private final ObjectMapper objectMapper;

  /**
   * Backs up the current identity file and overwrites it with {@code content}.
   *
   * @throws UploadRejectedException when {@code secret} does not match the configured admin pass
   * @throws IllegalArgumentException when {@code content} is not a JSON object
   */
  public void replace(String secret, byte[] content) {
    if (!secretMatches(secret)) {
      logger.warn("identity upload rejected: admin pass mismatch");
      throw new UploadRejectedException();
    }
    if (content == null || content.length == 0) {
      throw new IllegalArgumentException("uploaded file is empty");
    }
    final JsonNode document;
    try {
      document = objectMapper.readTree(content);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("uploaded file is not valid JSON", ex);
    } catch (IOException ex) {
      throw new IllegalArgumentException("uploaded file could not be read", ex);
    }
    if (document == null || document.isMissingNode()) {
      throw new IllegalArgumentException("uploaded file is not valid JSON");
    }
    // ストアはトップレベルをアイデンティティ ID のマップとして読む
    if (!document.isObject()) {
      throw new IllegalArgumentException("uploaded file must be a JSON object keyed by identity id");
    }
    identityStore.replaceWith(document);
    logger.info("identity file replaced by upload bytes={}", content.length);
  }

  private boolean secretMatches(String secret) {
    final String expected = properties.adminPass();
    if (expected.isBlank() || secret == null) {
      return false;
    }
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), secret.getBytes(StandardCharsets.UTF_8));
  }
}
