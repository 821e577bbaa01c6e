/*
 * どこで: Directory 設定バインドテスト
 * 何を: 更新間隔/招待バッチ/ページ送り/運用者設定のバインドと検証を確認する
 * なぜ: Duration 表記やカンマ区切りの ID 一覧が起動時に正しく解釈されることを保証するため
 */
package com.example.directory.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class DirectoryPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsDurationsListsAndPaths() {
    contextRunner
        .withPropertyValues(
            "directory.refresh.enabled=true",
            "directory.refresh.interval=5h",
            "directory.refresh.initial-delay=1m",
            "directory.invite.batch-size=5",
            "directory.invite.inter-batch-delay=5s",
            "directory.pagination.page-size=20",
            "directory.pagination.token-ttl=2m",
            "directory.operators.internal-token=token-x",
            "directory.operators.operator-ids=op-1, op-2,,",
            "directory.store.users-file=/var/lib/directory/users.json")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final CredentialRefreshProperties refresh =
                  context.getBean(CredentialRefreshProperties.class);
              final InviteProperties invite = context.getBean(InviteProperties.class);
              final PaginationProperties pagination = context.getBean(PaginationProperties.class);
              final OperatorProperties operators = context.getBean(OperatorProperties.class);
              final DirectoryStoreProperties store = context.getBean(DirectoryStoreProperties.class);

              assertThat(refresh.interval()).isEqualTo(Duration.ofHours(5));
              assertThat(refresh.initialDelay()).isEqualTo(Duration.ofMinutes(1));
              assertThat(invite.interBatchDelay()).isEqualTo(Duration.ofSeconds(5));
              assertThat(pagination.tokenTtl()).isEqualTo(Duration.ofMinutes(2));
              assertThat(pagination.signingSecret()).isEmpty();
              assertThat(operators.operatorIds()).containsExactly("op-1", "op-2");
              assertThat(operators.internalTokenHeaderName()).isEqualTo("X-Internal-Token");
              assertThat(operators.isOperator(" op-2 ")).isTrue();
              assertThat(store.usersBackupFile())
                  .isEqualTo(Path.of("/var/lib/directory/users_backup.json"));
              assertThat(store.settingsFile()).isEqualTo(Path.of("./data/config.json"));
            });
  }

  @Test
  void rejectsZeroBatchSize() {
    contextRunner
        .withPropertyValues(
            "directory.invite.batch-size=0",
            "directory.invite.inter-batch-delay=5s",
            "directory.pagination.page-size=20",
            "directory.pagination.token-ttl=2m")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsNegativeInterBatchDelay() {
    contextRunner
        .withPropertyValues(
            "directory.invite.batch-size=5",
            "directory.invite.inter-batch-delay=-1s",
            "directory.pagination.page-size=20",
            "directory.pagination.token-ttl=2m")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsZeroTokenTtl() {
    contextRunner
        .withPropertyValues(
            "directory.invite.batch-size=5",
            "directory.invite.inter-batch-delay=5s",
            "directory.pagination.page-size=20",
            "directory.pagination.token-ttl=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void platformDefaultsPointAtPublicApi() {
    contextRunner
        .withPropertyValues(
            "directory.invite.batch-size=5",
            "directory.invite.inter-batch-delay=5s",
            "directory.pagination.page-size=20",
            "directory.pagination.token-ttl=2m")
        .run(
            context -> {
              final PlatformClientProperties platform =
                  context.getBean(PlatformClientProperties.class);
              assertThat(platform.baseUrl()).isEqualTo("https://discord.com/api");
              assertThat(platform.scope()).isEqualTo("identify guilds.join");
              assertThat(platform.verifiedRoleConfigured()).isFalse();
              assertThat(platform.connectTimeout()).isEqualTo(Duration.ofSeconds(5));
              assertThat(platform.readTimeout()).isEqualTo(Duration.ofSeconds(10));
            });
  }

  @Test
  void platformTimeoutsBindAndNonPositiveFallsBack() {
    contextRunner
        .withPropertyValues(
            "directory.invite.batch-size=5",
            "directory.invite.inter-batch-delay=5s",
            "directory.pagination.page-size=20",
            "directory.pagination.token-ttl=2m",
            "platform.connect-timeout=2s",
            "platform.read-timeout=0s")
        .run(
            context -> {
              final PlatformClientProperties platform =
                  context.getBean(PlatformClientProperties.class);
              assertThat(platform.connectTimeout()).isEqualTo(Duration.ofSeconds(2));
              assertThat(platform.readTimeout()).isEqualTo(Duration.ofSeconds(10));
            });
  }

  @Configuration
  @EnableConfigurationProperties({
    CredentialRefreshProperties.class,
    InviteProperties.class,
    PaginationProperties.class,
    OperatorProperties.class,
    DirectoryStoreProperties.class,
    PlatformClientProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
