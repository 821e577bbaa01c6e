/*
 * どこで: app/directory/src/main/java/com/example/directory/api/VerificationCallbackController.java
 * 何を: OAuth 認可コールバックを受け付ける
 * なぜ: 認可コード交換とアイデンティティ登録の入口を 1 つに保つため
 */
package com.example.directory.api;

import com.example.common.ForwardedAddresses;
import com.example.directory.api.response.VerificationResponse;
import com.example.directory.model.IdentityRecord;
import com.example.directory.service.VerificationCallbackService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class VerificationCallbackController {

  private final VerificationCallbackService callbackService;

  @GetMapping("/callback")
  public VerificationResponse callback(
      @RequestParam(value = "code", required = false) String code, HttpServletRequest request) {
    final String origin =
        ForwardedAddresses.resolve(request.getHeader("X-Forwarded-For"), request.getRemoteAddr());
    final IdentityRecord record = callbackService.handleCallback(code, origin);
    return new VerificationResponse(record.id(), record.displayName(), record.verifiedAt());
  }
}
