package com.example.directory.service;

public class UploadRejectedException extends RuntimeException {
  public UploadRejectedException() {
    super("not permitted");
  }
}
