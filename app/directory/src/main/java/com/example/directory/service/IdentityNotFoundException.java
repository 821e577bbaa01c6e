package com.example.directory.service;

public class IdentityNotFoundException extends RuntimeException {
  public IdentityNotFoundException(String identityId) {
    super("identity not found: " + identityId);
  }
}
