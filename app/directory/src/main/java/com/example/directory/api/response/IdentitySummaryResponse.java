package com.example.directory.api.response;

import com.example.directory.model.IdentityRecord;
import java.time.Instant;

/** Identity as shown to operators. Tokens never leave the service. */
public record IdentitySummaryResponse(
    String id,
    String displayName,
    String originAddress,
    Instant verifiedAt,
    String avatarRef,
    boolean hasRefreshToken) {

  public static IdentitySummaryResponse from(IdentityRecord record) {
    return new IdentitySummaryResponse(
        record.id(),
        record.displayName(),
        record.originAddress(),
        record.verifiedAt(),
        record.avatarRef(),
        record.hasRefreshToken());
  }
}
