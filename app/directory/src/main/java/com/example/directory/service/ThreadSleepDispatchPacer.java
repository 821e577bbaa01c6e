/*
 * どこで: Directory サービス層
 * 何を: バッチ間の待機を実スリープで行う
 * なぜ: 割り込まれても待機を短縮せず、外部 API のレート制限を守るため
 */
package com.example.directory.service;

import com.google.common.util.concurrent.Uninterruptibles;
import java.time.Duration;
import org.springframework.stereotype.Component;

@Component
public class ThreadSleepDispatchPacer implements DispatchPacer {

  /** Sleeps the full {@code delay}; an interrupt received meanwhile is re-asserted on return. */
  @Override
  public void pause(Duration delay) {
    if (delay == null || delay.isZero() || delay.isNegative()) {
      return;
    }
    Uninterruptibles.sleepUninterruptibly(delay);
  }
}
