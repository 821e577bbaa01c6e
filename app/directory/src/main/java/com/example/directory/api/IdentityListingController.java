package com.example.directory.api;

import com.example.directory.api.request.PageRedeemRequest;
import com.example.directory.api.response.IdentityPageResponse;
import com.example.directory.config.ActorHeaders;
import com.example.directory.service.IdentityListingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Redeems a page navigation token. Open to any authenticated internal caller: the token itself
 * binds the page to the actor who opened the listing.
 */
@RestController
@RequestMapping("/listing")
@RequiredArgsConstructor
public class IdentityListingController {

  private final IdentityListingService listingService;

  @PostMapping("/pages:redeem")
  public IdentityPageResponse redeem(
      @RequestHeader(ActorHeaders.ACTOR_USER_ID) String actorUserId,
      @Valid @RequestBody PageRedeemRequest request) {
    return IdentityPageResponse.from(listingService.redeem(request.token(), actorUserId));
  }
}
