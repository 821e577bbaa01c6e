package com.example.directory.api.response;

public record SettingsResponse(String verifiedLogChannelId) {}
