/*
 * どこで: Directory サービス層テスト
 * 何を: バッチ分割・バッチ間待機・失敗の局所化を検証する
 * なぜ: レート制限を守る順序保証が崩れる回帰を防ぐため
 */
package com.example.directory.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.directory.model.DispatchResult;
import com.example.directory.model.IdentityRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BatchDispatcherTest {

  private static final Duration DELAY = Duration.ofSeconds(5);

  @Mock private GroupMembershipClient membershipClient;

  private ExecutorService executor;
  private RecordingPacer pacer;
  private AtomicInteger completedCalls;
  private SimpleMeterRegistry registry;
  private BatchDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(5);
    completedCalls = new AtomicInteger();
    pacer = new RecordingPacer(completedCalls);
    registry = new SimpleMeterRegistry();
    dispatcher =
        new BatchDispatcher(membershipClient, executor, pacer, new DirectoryMetrics(registry));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void thirteenRecordsRunAsThreeBatchesWithTwoPauses() {
    doAnswer(
            invocation -> {
              completedCalls.incrementAndGet();
              return null;
            })
        .when(membershipClient)
        .addMember(eq("g-1"), anyString(), anyString());

    final DispatchResult result = dispatcher.dispatch(records(13), "g-1", 5, DELAY);

    assertThat(result.success()).isEqualTo(13);
    assertThat(result.failed()).isZero();
    assertThat(pacer.delays).containsExactly(DELAY, DELAY);
    // 各待機時点で直前バッチまでの呼び出しがすべて完了している
    assertThat(pacer.completedAtPause).containsExactly(5, 10);
    assertThat(completedCalls.get()).isEqualTo(13);
  }

  @Test
  void recordWithoutAccessTokenFailsWithoutCall() {
    final List<IdentityRecord> records = new ArrayList<>(records(2));
    records.add(new IdentityRecord("no-token", "n", null, "rt", null, Instant.EPOCH, null));

    final DispatchResult result = dispatcher.dispatch(records, "g-1", 5, DELAY);

    assertThat(result.success()).isEqualTo(2);
    assertThat(result.failed()).isEqualTo(1);
    verify(membershipClient, never()).addMember(eq("g-1"), eq("no-token"), any());
    assertThat(pacer.delays).isEmpty();
  }

  @Test
  void singleFailureIsIsolated() {
    doAnswer(
            invocation -> {
              if ("id-3".equals(invocation.getArgument(1))) {
                throw new PlatformIntegrationException(
                    PlatformIntegrationException.Reason.FORBIDDEN, "platform member add failed");
              }
              return null;
            })
        .when(membershipClient)
        .addMember(eq("g-1"), anyString(), anyString());

    final DispatchResult result = dispatcher.dispatch(records(7), "g-1", 3, DELAY);

    assertThat(result.success()).isEqualTo(6);
    assertThat(result.failed()).isEqualTo(1);
    assertThat(pacer.delays).hasSize(2);
    assertThat(registry.get("directory.invite.total").tag("result", "failed").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void emptyInputMakesNoCalls() {
    final DispatchResult result = dispatcher.dispatch(List.of(), "g-1", 5, DELAY);

    assertThat(result).isEqualTo(DispatchResult.empty());
    assertThat(pacer.delays).isEmpty();
  }

  @Test
  void rejectsNonPositiveBatchSize() {
    assertThatThrownBy(() -> dispatcher.dispatch(records(1), "g-1", 0, DELAY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static List<IdentityRecord> records(int count) {
    final List<IdentityRecord> records = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      records.add(
          new IdentityRecord("id-" + i, "user-" + i, "at-" + i, "rt-" + i, null, Instant.EPOCH, null));
    }
    return records;
  }

  private static final class RecordingPacer implements DispatchPacer {
    private final AtomicInteger completedCalls;
    private final List<Duration> delays = new CopyOnWriteArrayList<>();
    private final List<Integer> completedAtPause = new CopyOnWriteArrayList<>();

    private RecordingPacer(AtomicInteger completedCalls) {
      this.completedCalls = completedCalls;
    }

    @Override
    public void pause(Duration delay) {
      delays.add(delay);
      completedAtPause.add(completedCalls.get());
    }
  }
}
