package com.example.directory.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials of the command-dispatch caller and the operator allow-list.
 *
 * <p>{@code operatorIds} binds from a comma separated {@code OPERATOR_IDS}.
 */
@ConfigurationProperties(prefix = "directory.operators")
public record OperatorProperties(
    String internalTokenHeaderName, String internalToken, List<String> operatorIds) {

  public OperatorProperties {
    internalTokenHeaderName =
        internalTokenHeaderName == null || internalTokenHeaderName.isBlank()
            ? "X-Internal-Token"
            : internalTokenHeaderName;
    internalToken = internalToken == null ? "" : internalToken;
    operatorIds =
        operatorIds == null
            ? List.of()
            : operatorIds.stream()
                .filter(id -> id != null && !id.isBlank())
                .map(String::trim)
                .toList();
  }

  public boolean isOperator(String actorId) {
    return actorId != null && operatorIds.contains(actorId.trim());
  }
}
