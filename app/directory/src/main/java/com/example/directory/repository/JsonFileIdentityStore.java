/*
 * どこで: Directory リポジトリ層
 * 何を: users.json を読み書きするアイデンティティストア
 * なぜ: 読み込み失敗時も稼働を継続し、読めないエントリを書き込みで失わないため
 */
package com.example.directory.repository;

import com.example.directory.config.DirectoryStoreProperties;
import com.example.directory.model.IdentityRecord;
import com.example.directory.service.DirectoryMetrics;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JsonFileIdentityStore implements IdentityStore {

  private static final Logger logger = LoggerFactory.getLogger(JsonFileIdentityStore.class);
  private static final TypeReference<LinkedHashMap<String, JsonNode>> DOCUMENT_TYPE =
      new TypeReference<>() {};

  private final JsonFileAccess files;
  private final DirectoryStoreProperties properties;
  private final DirectoryMetrics metrics;
  // 同一プロセス内の load→mutate→save だけを直列化する。他プロセス/長時間処理との競合は残る
  private final Object writeLock = new Object();

  @Override
  public Map<String, IdentityRecord> load() {
    final Path file = properties.usersFile();
    try {
      return readDocument(file, true).identities();
    } catch (IOException | RuntimeException ex) {
      logger.error("identity store load failed file={}", file, ex);
      metrics.recordStoreError("load");
      return new LinkedHashMap<>();
    }
  }

  /**
   * Writes {@code identities}. Entries already in the file that could not be read as records are
   * carried over unchanged unless {@code identities} holds the same key.
   */
  @Override
  public void save(Map<String, IdentityRecord> identities) {
    final Path file = properties.usersFile();
    try {
      final Map<String, Object> document = new LinkedHashMap<>(identities);
      for (Map.Entry<String, JsonNode> entry : unreadableEntries(file).entrySet()) {
        document.putIfAbsent(entry.getKey(), entry.getValue());
      }
      files.write(file, document);
    } catch (IOException | RuntimeException ex) {
      logger.error("identity store save failed file={} size={}", file, identities.size(), ex);
      metrics.recordStoreError("save");
    }
  }

  @Override
  public Optional<IdentityRecord> find(String id) {
    if (id == null || id.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(load().get(id.trim()));
  }

  @Override
  public void upsert(IdentityRecord record) {
    if (record == null || record.id() == null || record.id().isBlank()) {
      throw new IllegalArgumentException("identity id is required");
    }
    synchronized (writeLock) {
      final Map<String, IdentityRecord> identities = load();
      identities.put(record.id(), record);
      save(identities);
    }
  }

  @Override
  public boolean remove(String id) {
    if (id == null || id.isBlank()) {
      return false;
    }
    synchronized (writeLock) {
      final Map<String, IdentityRecord> identities = load();
      if (identities.remove(id.trim()) == null) {
        return false;
      }
      save(identities);
      return true;
    }
  }

  @Override
  public void clear() {
    final Path file = properties.usersFile();
    synchronized (writeLock) {
      try {
        files.write(file, new LinkedHashMap<>());
      } catch (IOException ex) {
        metrics.recordStoreError("clear");
        throw new DirectoryStoreException("failed to clear identity file", ex);
      }
    }
    logger.info("identity store cleared file={}", file);
  }

  @Override
  public void replaceWith(JsonNode document) {
    final Path file = properties.usersFile();
    final Path backup = properties.usersBackupFile();
    synchronized (writeLock) {
      try {
        if (Files.exists(file)) {
          files.copy(file, backup);
          logger.info("identity store backed up file={} backup={}", file, backup);
        }
        files.write(file, document);
      } catch (IOException ex) {
        metrics.recordStoreError("replace");
        throw new DirectoryStoreException("failed to replace identity file", ex);
      }
    }
    logger.info("identity store replaced file={}", file);
  }

  private Map<String, JsonNode> unreadableEntries(Path file) {
    try {
      return readDocument(file, false).unreadable();
    } catch (IOException | RuntimeException ex) {
      // 壊れたファイルは上書きで復旧させる
      logger.warn("identity store overwriting unreadable file={} cause={}", file, ex.getMessage());
      return Map.of();
    }
  }

  private StoredDocument readDocument(Path file, boolean report) throws IOException {
    final Map<String, JsonNode> raw = files.read(file, DOCUMENT_TYPE).orElseGet(LinkedHashMap::new);
    final Map<String, IdentityRecord> identities = new LinkedHashMap<>();
    final Map<String, JsonNode> unreadable = new LinkedHashMap<>();
    for (Map.Entry<String, JsonNode> entry : raw.entrySet()) {
      final String key = entry.getKey();
      final JsonNode node = entry.getValue();
      if (key == null || key.isBlank() || node == null || node.isNull()) {
        logger.warn("identity store skipped empty entry key={}", key);
        continue;
      }
      final IdentityRecord record;
      try {
        record = files.convert(node, IdentityRecord.class);
      } catch (IOException | IllegalArgumentException ex) {
        // save 時の再読込では同じエントリを二重に報告しない
        if (report) {
          logger.warn("identity store kept unreadable entry key={} cause={}", key, ex.getMessage());
          metrics.recordStoreError("read_entry");
        }
        unreadable.put(key, node);
        continue;
      }
      identities.put(key, normalize(key, record));
    }
    return new StoredDocument(identities, unreadable);
  }

  private static IdentityRecord normalize(String key, IdentityRecord record) {
    if (key.equals(record.id())) {
      return record;
    }
    if (record.id() != null && !record.id().isBlank()) {
      logger.warn("identity store re-keyed record key={} recordId={}", key, record.id());
    }
    return record.withId(key);
  }

  private record StoredDocument(
      Map<String, IdentityRecord> identities, Map<String, JsonNode> unreadable) {}
}
