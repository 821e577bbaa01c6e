/*
 * どこで: Directory 設定
 * 何を: バッチ内のメンバー追加呼び出しを並行実行するワーカープール
 * なぜ: 1 バッチ分を同時に実行するため、プールをバッチサイズに合わせる
 */
package com.example.directory.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatchExecutorConfig {

  @Bean(destroyMethod = "shutdown")
  ExecutorService directoryDispatchExecutor(InviteProperties properties) {
    final AtomicInteger sequence = new AtomicInteger();
    final ThreadFactory threadFactory =
        runnable -> {
          final Thread thread = new Thread(runnable, "invite-dispatch-" + sequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(Math.max(1, properties.batchSize()), threadFactory);
  }
}
