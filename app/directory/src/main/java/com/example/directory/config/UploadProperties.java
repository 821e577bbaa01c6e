package com.example.directory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "directory.upload")
public record UploadProperties(String adminPass) {

  public UploadProperties {
    adminPass = adminPass == null ? "" : adminPass;
  }
}
