/*
 * どこで: app/directory/src/main/java/com/example/directory/api/ApiErrorResponse.java
 * 何を: API エラー応答の共通 DTO
 * なぜ: コマンド中継側がエラー種別を code で機械的に判定できるようにするため
 */
package com.example.directory.api;

public record ApiErrorResponse(String code, String message) {}
