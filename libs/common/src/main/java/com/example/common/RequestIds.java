package com.example.common;

import java.util.UUID;

/** Request correlation ids: reuse the caller's id when present, otherwise mint one. */
public final class RequestIds {
  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  public static String resolve(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      return newRequestId();
    }
    return headerValue.trim();
  }
}
