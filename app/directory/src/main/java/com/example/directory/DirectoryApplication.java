/*
 * どこで: Directory アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジュールを有効化する
 * なぜ: トークン更新ワーカーと設定レコードを起動時にまとめて登録するため
 */
package com.example.directory;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
@RestController
public class DirectoryApplication {

  public static void main(String[] args) {
    SpringApplication.run(DirectoryApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "directory: ok";
  }
}
