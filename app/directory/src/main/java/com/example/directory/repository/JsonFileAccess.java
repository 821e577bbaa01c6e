/*
 * どこで: Directory リポジトリ層
 * 何を: ローカルファイル上の JSON ドキュメントを丸ごと読み書きする
 * なぜ: users.json と config.json で同じ読み込み/アトミック置換の仕組みを共有するため
 */
package com.example.directory.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JsonFileAccess {

  private final ObjectMapper objectMapper;

  /** Empty when the file does not exist or holds only whitespace. */
  public <T> Optional<T> read(Path file, TypeReference<T> type) throws IOException {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    final byte[] content = Files.readAllBytes(file);
    if (new String(content, StandardCharsets.UTF_8).isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(objectMapper.readValue(content, type));
  }

  /** Binds one already-parsed JSON node to {@code type}. */
  public <T> T convert(JsonNode node, Class<T> type) throws IOException {
    return objectMapper.treeToValue(node, type);
  }

  /**
   * Writes {@code value} to a temp file in the same directory and moves it over {@code file}, so
   * a concurrent reader sees either the old or the new document.
   */
  public void write(Path file, Object value) throws IOException {
    final Path target = file.toAbsolutePath();
    final Path directory = target.getParent();
    Files.createDirectories(directory);
    final Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
    try {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  public void copy(Path source, Path target) throws IOException {
    Files.createDirectories(target.toAbsolutePath().getParent());
    Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
  }
}
