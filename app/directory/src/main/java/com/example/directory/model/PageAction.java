package com.example.directory.model;

import java.util.Arrays;
import java.util.Optional;

public enum PageAction {
  PREVIOUS("prev"),
  NEXT("next");

  private final String value;

  PageAction(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<PageAction> fromValue(String value) {
    return Arrays.stream(values()).filter(action -> action.value.equals(value)).findFirst();
  }
}
