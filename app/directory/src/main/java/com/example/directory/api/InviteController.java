package com.example.directory.api;

import com.example.directory.model.DispatchResult;
import com.example.directory.service.InviteService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/groups/{groupId}")
@RequiredArgsConstructor
public class InviteController {

  private final InviteService inviteService;

  @PostMapping("/members/{identityId}")
  public ResponseEntity<Void> inviteOne(
      @PathVariable("groupId") String groupId, @PathVariable("identityId") String identityId) {
    inviteService.inviteOne(groupId, identityId);
    return ResponseEntity.noContent().build();
  }

  /** Refreshes every credential first, then invites in rate-limited batches. */
  @PostMapping("/members:invite-all")
  public DispatchResult inviteAll(@PathVariable("groupId") String groupId) {
    return inviteService.inviteAll(groupId);
  }
}
