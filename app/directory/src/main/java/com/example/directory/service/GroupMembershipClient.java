/*
 * どこで: Directory サービス層
 * 何を: グループ(ギルド)へのメンバー追加とロール付与を Bot 権限で呼び出す
 * なぜ: 招待とコールバック時のロール付与で同じ認可ヘッダとエラー分類を使うため
 */
package com.example.directory.service;

import com.example.directory.config.PlatformClientProperties;
import com.example.directory.service.dto.MemberAddRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
@RequiredArgsConstructor
public class GroupMembershipClient {

  private static final String MEMBER_PATH = "/guilds/{groupId}/members/{userId}";
  private static final String MEMBER_ROLE_PATH = "/guilds/{groupId}/members/{userId}/roles/{roleId}";

  private final RestClient platformRestClient;
  private final PlatformClientProperties properties;

  /** Adds the identity to the group using its own access token. Already-a-member is success. */
  public void addMember(String groupId, String userId, String accessToken) {
    if (accessToken == null || accessToken.isBlank()) {
      throw new IllegalArgumentException("access token is required");
    }
    try {
      platformRestClient
          .put()
          .uri(MEMBER_PATH, groupId, userId)
          .header(HttpHeaders.AUTHORIZATION, botAuthorization())
          .contentType(MediaType.APPLICATION_JSON)
          .body(new MemberAddRequest(accessToken))
          .retrieve()
          .toBodilessEntity();
    } catch (RuntimeException ex) {
      throw PlatformErrorTranslator.translate("member add", ex);
    }
  }

  public void grantRole(String groupId, String userId, String roleId) {
    try {
      platformRestClient
          .put()
          .uri(MEMBER_ROLE_PATH, groupId, userId, roleId)
          .header(HttpHeaders.AUTHORIZATION, botAuthorization())
          .retrieve()
          .toBodilessEntity();
    } catch (RuntimeException ex) {
      throw PlatformErrorTranslator.translate("role grant", ex);
    }
  }

  private String botAuthorization() {
    return "Bot " + properties.botToken();
  }
}
