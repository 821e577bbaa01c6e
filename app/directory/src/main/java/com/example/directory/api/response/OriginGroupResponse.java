package com.example.directory.api.response;

import com.example.directory.model.OriginGroup;
import java.util.List;

public record OriginGroupResponse(String originAddress, List<IdentitySummaryResponse> identities) {

  public static OriginGroupResponse from(OriginGroup group) {
    return new OriginGroupResponse(
        group.originAddress(),
        group.identities().stream().map(IdentitySummaryResponse::from).toList());
  }
}
