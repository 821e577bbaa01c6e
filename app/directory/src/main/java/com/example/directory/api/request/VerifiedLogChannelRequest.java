package com.example.directory.api.request;

import jakarta.validation.constraints.NotBlank;

public record VerifiedLogChannelRequest(@NotBlank String channelId) {}
