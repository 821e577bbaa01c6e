/*
 * どこで: Directory サービス層
 * 何を: 認可コードの交換失敗を表現する
 * なぜ: コールバックを 400 応答へ変換し、ストアを変更しないことを明示するため
 */
package com.example.directory.service;

public class VerificationFailedException extends RuntimeException {
  public VerificationFailedException(String message) {
    super(message);
  }

  public VerificationFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
