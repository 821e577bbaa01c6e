/*
 * どこで: Directory セキュリティ設定
 * 何を: パスごとの認可ルールとステートレスなフィルタチェーン
 * なぜ: 公開コールバックと管理 API の境界をフィルタチェーンで固定するため
 */
package com.example.directory.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;

@Configuration
public class DirectorySecurityConfig {

  @Bean
  OperatorAuthenticationFilter operatorAuthenticationFilter(OperatorProperties properties) {
    return new OperatorAuthenticationFilter(properties);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, OperatorAuthenticationFilter operatorAuthenticationFilter)
      throws Exception {
    // /upload は共有シークレットをコントローラ側で検証するため CSRF は使わない
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(operatorAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/callback",
                        "/upload",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers("/admin/**")
                    .hasRole("OPERATOR")
                    .requestMatchers("/listing/**")
                    .hasRole("INTERNAL")
                    .anyRequest()
                    .authenticated())
        .exceptionHandling(
            ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)));
    return http.build();
  }
}
