package com.example.directory.repository;

import com.example.directory.model.IdentityRecord;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Optional;

/**
 * Mapping from identity id to {@link IdentityRecord}, backed by a single document.
 *
 * <p>{@link #load()} and {@link #save(Map)} never throw: a failed read yields an empty mapping and
 * a failed write is logged and dropped. A document entry that cannot be bound to a record is left
 * out of {@link #load()} but kept in the document across saves. Every compound operation reloads immediately before it
 * mutates. This narrows, but does not close, the window in which a flow that loaded earlier (a
 * refresh pass, a cleanup sweep) overwrites a newer single-record change: last writer wins.
 */
public interface IdentityStore {

  /** Mutable snapshot in document order. */
  Map<String, IdentityRecord> load();

  void save(Map<String, IdentityRecord> identities);

  Optional<IdentityRecord> find(String id);

  void upsert(IdentityRecord record);

  boolean remove(String id);

  /** Empties the document. Failures propagate as {@link DirectoryStoreException}. */
  void clear();

  /**
   * Backs up the current document to its sibling backup path and overwrites it with {@code
   * document}. Unlike {@link #save(Map)}, failures propagate as {@link DirectoryStoreException}.
   */
  void replaceWith(JsonNode document);
}
