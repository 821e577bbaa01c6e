package com.example.directory.repository;

public class DirectoryStoreException extends RuntimeException {

  public DirectoryStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
