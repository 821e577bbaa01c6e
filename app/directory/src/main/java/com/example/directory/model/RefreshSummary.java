package com.example.directory.model;

public record RefreshSummary(int refreshed, int deleted) {

  public int processed() {
    return refreshed + deleted;
  }
}
