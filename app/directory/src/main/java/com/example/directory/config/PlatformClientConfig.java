/*
 * どこで: Directory 設定
 * 何を: プラットフォーム API 呼び出し専用 RestClient を提供する
 * なぜ: OAuth/ユーザー/メンバー/チャンネル各クライアントで baseUrl とタイムアウトを共有するため
 */
package com.example.directory.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class PlatformClientConfig {

  @Bean
  RestClient platformRestClient(RestClient.Builder builder, PlatformClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
