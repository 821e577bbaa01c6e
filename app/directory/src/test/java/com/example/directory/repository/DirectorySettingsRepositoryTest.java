package com.example.directory.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.directory.config.DirectoryStoreProperties;
import com.example.directory.model.DirectorySettings;
import com.example.directory.service.DirectoryMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectorySettingsRepositoryTest {

  @TempDir Path tempDir;

  @Test
  void savesAndLoadsVerifiedChannel() throws IOException {
    final DirectorySettingsRepository repository = newRepository();

    repository.save(DirectorySettings.empty().withVerifiedLogChannel("c-1"));

    assertThat(repository.load().verifiedLogChannelId()).isEqualTo("c-1");
    assertThat(Files.readString(tempDir.resolve("config.json"))).contains("\"verified_channel\"");
  }

  @Test
  void missingFileLoadsEmptySettings() {
    assertThat(newRepository().load().hasVerifiedLogChannel()).isFalse();
  }

  private DirectorySettingsRepository newRepository() {
    return new DirectorySettingsRepository(
        new JsonFileAccess(new ObjectMapper()),
        new DirectoryStoreProperties(tempDir.resolve("users.json"), tempDir.resolve("config.json")),
        new DirectoryMetrics(new SimpleMeterRegistry()));
  }
}
