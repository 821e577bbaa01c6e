/*
 * どこで: app/directory/src/main/java/com/example/directory/model/IdentityRecord.java
 * 何を: users.json の 1 エントリに相当する認証済みアイデンティティ
 * なぜ: トークン対とメタデータを 1 レコードで扱い、更新/削除の単位を揃えるため
 */
package com.example.directory.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * One externally-authorized identity and its OAuth token pair.
 *
 * <p>A record without a refresh token can never be renewed; the refresh pass evicts it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdentityRecord(
    @JsonProperty("id") String id,
    @JsonProperty("username") String displayName,
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("ip") String originAddress,
    @JsonProperty("verifiedAt") Instant verifiedAt,
    @JsonProperty("avatar") String avatarRef) {

  public static final String UNKNOWN_DISPLAY_NAME = "UnknownUser";
  public static final String UNKNOWN_ORIGIN = "Unknown";

  public IdentityRecord {
    displayName = displayName == null || displayName.isBlank() ? UNKNOWN_DISPLAY_NAME : displayName;
    originAddress =
        originAddress == null || originAddress.isBlank() ? UNKNOWN_ORIGIN : originAddress;
  }

  public boolean hasAccessToken() {
    return accessToken != null && !accessToken.isBlank();
  }

  public boolean hasRefreshToken() {
    return refreshToken != null && !refreshToken.isBlank();
  }

  public IdentityRecord withId(String newId) {
    return new IdentityRecord(
        newId, displayName, accessToken, refreshToken, originAddress, verifiedAt, avatarRef);
  }

  public IdentityRecord withTokens(String newAccessToken, String newRefreshToken) {
    return new IdentityRecord(
        id, displayName, newAccessToken, newRefreshToken, originAddress, verifiedAt, avatarRef);
  }
}
