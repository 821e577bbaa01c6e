/*
 * どこで: Directory セキュリティ統合テスト
 * 何を: 内部トークン/運用者許可リスト/公開エンドポイントの認可結果を検証する
 * なぜ: 運用者以外が管理コマンドを実行できる回帰を防ぐため
 */
package com.example.directory.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.directory.config.ActorHeaders;
import com.example.directory.model.IdentityPageView;
import com.example.directory.model.IdentityRecord;
import com.example.directory.service.DirectoryAdminService;
import com.example.directory.service.IdentityListingService;
import com.example.directory.service.VerificationCallbackService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DirectorySecurityIntegrationTest {

  private static final String TOKEN_HEADER = "X-Internal-Token";
  private static final String TOKEN = "test-internal-token";

  @Autowired private MockMvc mockMvc;
  @MockitoBean private DirectoryAdminService adminService;
  @MockitoBean private IdentityListingService listingService;
  @MockitoBean private VerificationCallbackService callbackService;

  @Test
  void adminWithoutInternalTokenReturns401() throws Exception {
    mockMvc
        .perform(delete("/admin/identities").header(ActorHeaders.ACTOR_USER_ID, "operator-1"))
        .andExpect(status().isUnauthorized());
    verifyNoInteractions(adminService);
  }

  @Test
  void adminWithWrongInternalTokenReturns401() throws Exception {
    mockMvc
        .perform(
            delete("/admin/identities")
                .header(TOKEN_HEADER, "wrong")
                .header(ActorHeaders.ACTOR_USER_ID, "operator-1"))
        .andExpect(status().isUnauthorized());
    verifyNoInteractions(adminService);
  }

  @Test
  void adminWithoutActorReturns401() throws Exception {
    mockMvc
        .perform(delete("/admin/identities").header(TOKEN_HEADER, TOKEN))
        .andExpect(status().isUnauthorized());
    verifyNoInteractions(adminService);
  }

  @Test
  void nonOperatorIsForbiddenAndNothingHappens() throws Exception {
    mockMvc
        .perform(
            delete("/admin/identities")
                .header(TOKEN_HEADER, TOKEN)
                .header(ActorHeaders.ACTOR_USER_ID, "user-9"))
        .andExpect(status().isForbidden());
    verifyNoInteractions(adminService);
  }

  @Test
  void operatorCanRunAdminCommands() throws Exception {
    when(adminService.removeAll()).thenReturn(0);

    mockMvc
        .perform(
            delete("/admin/identities")
                .header(TOKEN_HEADER, TOKEN)
                .header(ActorHeaders.ACTOR_USER_ID, "operator-1"))
        .andExpect(status().isOk());
  }

  @Test
  void pageRedemptionIsOpenToAnyAuthenticatedActor() throws Exception {
    when(listingService.redeem("tok", "user-9"))
        .thenReturn(new IdentityPageView(1, 1, 0, List.of(), null, null));

    mockMvc
        .perform(
            post("/listing/pages:redeem")
                .header(TOKEN_HEADER, TOKEN)
                .header(ActorHeaders.ACTOR_USER_ID, "user-9")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"token\":\"tok\"}"))
        .andExpect(status().isOk());
  }

  @Test
  void pageRedemptionWithoutInternalTokenReturns401() throws Exception {
    mockMvc
        .perform(
            post("/listing/pages:redeem")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"token\":\"tok\"}"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void callbackIsPublic() throws Exception {
    when(callbackService.handleCallback(any(), any()))
        .thenReturn(new IdentityRecord("42", "Alice", "at", "rt", null, Instant.EPOCH, null));

    mockMvc.perform(get("/callback").param("code", "c")).andExpect(status().isOk());
  }

  @Test
  void uploadIsReachableWithoutInternalToken() throws Exception {
    final int statusCode =
        mockMvc.perform(post("/upload")).andReturn().getResponse().getStatus();
    assertThat(statusCode).isNotEqualTo(401);
  }

  @Test
  void healthIsPublic() throws Exception {
    mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
  }
}
