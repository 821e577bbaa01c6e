package com.example.directory.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Operator-set settings persisted next to the identity file. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DirectorySettings(@JsonProperty("verified_channel") String verifiedLogChannelId) {

  public static DirectorySettings empty() {
    return new DirectorySettings(null);
  }

  public boolean hasVerifiedLogChannel() {
    return verifiedLogChannelId != null && !verifiedLogChannelId.isBlank();
  }

  public DirectorySettings withVerifiedLogChannel(String channelId) {
    return new DirectorySettings(channelId);
  }
}
