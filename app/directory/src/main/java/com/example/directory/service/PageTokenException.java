package com.example.directory.service;

public class PageTokenException extends RuntimeException {

  public enum Reason {
    EXPIRED,
    FORBIDDEN,
    MALFORMED
  }

  private final Reason reason;

  public PageTokenException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
