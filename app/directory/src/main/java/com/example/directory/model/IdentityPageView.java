package com.example.directory.model;

import java.util.List;

/**
 * One rendered page of the identity listing. A {@code null} token means the corresponding
 * control is disabled.
 */
public record IdentityPageView(
    int page,
    int pageCount,
    int total,
    List<IdentityRecord> entries,
    String previousToken,
    String nextToken) {

  public IdentityPageView {
    entries = entries == null ? List.of() : List.copyOf(entries);
  }
}
