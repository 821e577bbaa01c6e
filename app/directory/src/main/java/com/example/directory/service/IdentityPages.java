package com.example.directory.service;

/** Page arithmetic for the identity listing. Pages are 1-based. */
public final class IdentityPages {

  private IdentityPages() {}

  public static int pageCount(int total, int pageSize) {
    if (pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be at least 1");
    }
    return Math.max(1, (Math.max(0, total) + pageSize - 1) / pageSize);
  }

  public static int clamp(int page, int pageCount) {
    return Math.min(Math.max(page, 1), Math.max(1, pageCount));
  }
}
