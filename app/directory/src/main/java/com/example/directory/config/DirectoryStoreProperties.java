/*
 * どこで: Directory 設定バインド
 * 何を: users.json と config.json の配置場所
 * なぜ: 環境ごとにデータパスを切り替えられるようにするため (USERS_FILE / CONFIG_FILE)
 */
package com.example.directory.config;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "directory.store")
public record DirectoryStoreProperties(Path usersFile, Path settingsFile) {

  public DirectoryStoreProperties {
    usersFile = usersFile == null ? Path.of("./data/users.json") : usersFile;
    settingsFile = settingsFile == null ? Path.of("./data/config.json") : settingsFile;
  }

  /** users.json -> users_backup.json, next to the original. */
  public Path usersBackupFile() {
    final String fileName = usersFile.getFileName().toString();
    final String backupName =
        fileName.contains(".json")
            ? fileName.replaceFirst("\\.json", "_backup.json")
            : fileName + "_backup";
    return usersFile.resolveSibling(backupName);
  }
}
