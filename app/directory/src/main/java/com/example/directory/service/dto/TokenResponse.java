package com.example.directory.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(
    String accessToken, String refreshToken, String tokenType, Long expiresIn, String scope) {

  public boolean hasAccessToken() {
    return accessToken != null && !accessToken.isBlank();
  }

  public boolean hasRefreshToken() {
    return refreshToken != null && !refreshToken.isBlank();
  }

  public String authorizationScheme() {
    return tokenType == null || tokenType.isBlank() ? "Bearer" : tokenType;
  }
}
