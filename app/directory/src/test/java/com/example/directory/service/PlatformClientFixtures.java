package com.example.directory.service;

import com.example.directory.config.PlatformClientProperties;

final class PlatformClientFixtures {

  static final String BASE_URL = "http://platform.test/api";

  private PlatformClientFixtures() {}

  static PlatformClientProperties properties() {
    return new PlatformClientProperties(
        BASE_URL,
        "http://platform.test/oauth2/authorize",
        "client-1",
        "secret-1",
        "http://directory.test/callback",
        null,
        "bot-token-1",
        "home-group",
        "verified-role",
        null,
        null);
  }
}
