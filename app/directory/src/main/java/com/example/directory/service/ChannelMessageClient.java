/*
 * どこで: Directory サービス層
 * 何を: ボットトークンでチャンネルにメッセージを投稿する
 * なぜ: 認証完了をオペレーター向けチャンネルへ通知するため
 */
package com.example.directory.service;

import com.example.directory.config.PlatformClientProperties;
import com.example.directory.service.dto.ChannelMessageRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
@RequiredArgsConstructor
public class ChannelMessageClient {

  private static final String CHANNEL_MESSAGES_PATH = "/channels/{channelId}/messages";

  private final RestClient platformRestClient;
  private final PlatformClientProperties properties;

  public void postMessage(String channelId, String content) {
    try {
      platformRestClient
          .post()
          .uri(CHANNEL_MESSAGES_PATH, channelId)
          .header(HttpHeaders.AUTHORIZATION, "Bot " + properties.botToken())
          .contentType(MediaType.APPLICATION_JSON)
          .body(new ChannelMessageRequest(content))
          .retrieve()
          .toBodilessEntity();
    } catch (RuntimeException ex) {
      throw PlatformErrorTranslator.translate("channel message", ex);
    }
  }
}
