package com.example.directory.model;

import java.util.List;

/** Identities that verified from the same network origin. */
public record OriginGroup(String originAddress, List<IdentityRecord> identities) {

  public OriginGroup {
    identities = identities == null ? List.of() : List.copyOf(identities);
  }
}
