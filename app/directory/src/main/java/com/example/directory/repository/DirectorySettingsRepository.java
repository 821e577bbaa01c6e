/*
 * どこで: Directory リポジトリ層
 * 何を: config.json の運用設定を読み書きする
 * なぜ: ログチャンネルなどの設定を再起動後も保持するため
 */
package com.example.directory.repository;

import com.example.directory.config.DirectoryStoreProperties;
import com.example.directory.model.DirectorySettings;
import com.example.directory.service.DirectoryMetrics;
import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/** config.json holder. Same fail-soft contract as the identity store. */
@Repository
@RequiredArgsConstructor
public class DirectorySettingsRepository {

  private static final Logger logger = LoggerFactory.getLogger(DirectorySettingsRepository.class);
  private static final TypeReference<DirectorySettings> DOCUMENT_TYPE = new TypeReference<>() {};

  private final JsonFileAccess files;
  private final DirectoryStoreProperties properties;
  private final DirectoryMetrics metrics;

  public DirectorySettings load() {
    final Path file = properties.settingsFile();
    try {
      return files.read(file, DOCUMENT_TYPE).orElseGet(DirectorySettings::empty);
    } catch (IOException | RuntimeException ex) {
      logger.error("settings load failed file={}", file, ex);
      metrics.recordStoreError("settings_load");
      return DirectorySettings.empty();
    }
  }

  public void save(DirectorySettings settings) {
    final Path file = properties.settingsFile();
    try {
      files.write(file, settings);
    } catch (IOException | RuntimeException ex) {
      logger.error("settings save failed file={}", file, ex);
      metrics.recordStoreError("settings_save");
    }
  }
}
