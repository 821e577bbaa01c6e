/*
 * どこで: Directory セキュリティ設定
 * 何を: 内部トークンと操作者ヘッダーから認証情報を組み立てる
 * なぜ: オペレーター許可リストに応じてロールを付け分けるため
 */
package com.example.directory.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates the command-dispatch caller by its shared internal token and binds the acting
 * identity from {@link ActorHeaders#ACTOR_USER_ID}. Actors on the operator allow-list also get
 * {@code ROLE_OPERATOR}.
 */
public class OperatorAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(OperatorAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";
  private static final String OPERATOR_ROLE = "ROLE_OPERATOR";

  private final OperatorProperties properties;

  public OperatorAuthenticationFilter(OperatorProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !(uri.startsWith("/admin/") || uri.startsWith("/listing/"));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (!isValidInternalToken(request.getHeader(properties.internalTokenHeaderName()))) {
      logger.debug("internal authentication not established for path={}", request.getRequestURI());
      filterChain.doFilter(request, response);
      return;
    }
    final String actorId = request.getHeader(ActorHeaders.ACTOR_USER_ID);
    if (actorId == null || actorId.isBlank()) {
      logger.warn(
          "internal request rejected: missing required header {} on path={}",
          ActorHeaders.ACTOR_USER_ID,
          request.getRequestURI());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
      return;
    }
    final List<SimpleGrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority(INTERNAL_ROLE));
    if (properties.isOperator(actorId)) {
      authorities.add(new SimpleGrantedAuthority(OPERATOR_ROLE));
    }
    final UsernamePasswordAuthenticationToken authentication =
        new UsernamePasswordAuthenticationToken(actorId.trim(), "N/A", authorities);
    logger.debug(
        "internal authentication established for path={} actorId={} authorities={}",
        request.getRequestURI(),
        actorId,
        authorities);
    SecurityContextHolder.getContext().setAuthentication(authentication);
    filterChain.doFilter(request, response);
  }

  private boolean isValidInternalToken(String actualToken) {
    final String expected = properties.internalToken();
    if (actualToken == null || expected.isBlank()) {
      return false;
    }
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), actualToken.getBytes(StandardCharsets.UTF_8));
  }
}
