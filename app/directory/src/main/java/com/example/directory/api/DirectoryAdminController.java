/*
 * どこで: app/directory/src/main/java/com/example/directory/api/DirectoryAdminController.java
 * 何を: 運用者向けのディレクトリ参照/削除/掃除/更新コマンドを提供する
 * なぜ: 高権限操作を /admin 配下にまとめ、Security 設定で一括して保護するため
 */
package com.example.directory.api;

import com.example.directory.api.request.VerifiedLogChannelRequest;
import com.example.directory.api.response.IdentityPageResponse;
import com.example.directory.api.response.IdentitySummaryResponse;
import com.example.directory.api.response.OriginGroupResponse;
import com.example.directory.api.response.RemovedCountResponse;
import com.example.directory.api.response.SettingsResponse;
import com.example.directory.api.response.VerificationLinkResponse;
import com.example.directory.config.ActorHeaders;
import com.example.directory.model.CleanupSummary;
import com.example.directory.model.RefreshSummary;
import com.example.directory.service.AuthorizeLinkService;
import com.example.directory.service.CredentialRefreshService;
import com.example.directory.service.DirectoryAdminService;
import com.example.directory.service.IdentityListingService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class DirectoryAdminController {

  private final DirectoryAdminService adminService;
  private final IdentityListingService listingService;
  private final CredentialRefreshService refreshService;
  private final AuthorizeLinkService authorizeLinkService;

  @GetMapping("/verification-link")
  public VerificationLinkResponse verificationLink() {
    return new VerificationLinkResponse(authorizeLinkService.verificationLink());
  }

  @PutMapping("/settings/verified-log-channel")
  public SettingsResponse setVerifiedLogChannel(
      @Valid @RequestBody VerifiedLogChannelRequest request) {
    return new SettingsResponse(
        adminService.setVerifiedLogChannel(request.channelId()).verifiedLogChannelId());
  }

  /** First page of the listing, with navigation tokens bound to the calling actor. */
  @GetMapping("/identities")
  public IdentityPageResponse listIdentities(
      @RequestHeader(ActorHeaders.ACTOR_USER_ID) String actorUserId) {
    return IdentityPageResponse.from(listingService.openListing(actorUserId.trim()));
  }

  @GetMapping("/identities/{identityId}")
  public IdentitySummaryResponse findIdentity(@PathVariable("identityId") String identityId) {
    return IdentitySummaryResponse.from(adminService.find(identityId));
  }

  @GetMapping("/identities:shared-origins")
  public List<OriginGroupResponse> sharedOrigins() {
    return adminService.sharedOrigins().stream().map(OriginGroupResponse::from).toList();
  }

  @DeleteMapping("/identities/{identityId}")
  public ResponseEntity<Void> removeIdentity(@PathVariable("identityId") String identityId) {
    adminService.remove(identityId);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/identities")
  public RemovedCountResponse removeAll() {
    return new RemovedCountResponse(adminService.removeAll());
  }

  @PostMapping("/identities:cleanup")
  public CleanupSummary cleanup() {
    return adminService.cleanupInvalidTokens();
  }

  @PostMapping("/identities:refresh")
  public RefreshSummary refresh() {
    return refreshService.refreshAll();
  }
}
