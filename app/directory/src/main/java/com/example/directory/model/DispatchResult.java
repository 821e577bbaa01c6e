package com.example.directory.model;

public record DispatchResult(int success, int failed) {

  public static DispatchResult empty() {
    return new DispatchResult(0, 0);
  }
}
