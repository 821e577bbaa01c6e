/*
 * どこで: Common Web 共通処理
 * 何を: リバースプロキシ越しの送信元アドレスを解決する
 * なぜ: リクエストログと保存される送信元を同じアドレスで揃えるため
 */
package com.example.common;

public final class ForwardedAddresses {

  public static final String UNKNOWN = "Unknown";

  private ForwardedAddresses() {}

  /**
   * Returns the first hop of {@code X-Forwarded-For}, falling back to the socket peer address and
   * finally to {@link #UNKNOWN}.
   */
  public static String resolve(String forwardedFor, String remoteAddress) {
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      final int commaIndex = forwardedFor.indexOf(',');
      final String firstHop =
          commaIndex < 0 ? forwardedFor.trim() : forwardedFor.substring(0, commaIndex).trim();
      if (!firstHop.isEmpty()) {
        return firstHop;
      }
    }
    if (remoteAddress != null && !remoteAddress.isBlank()) {
      return remoteAddress.trim();
    }
    return UNKNOWN;
  }
}
