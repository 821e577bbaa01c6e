package com.example.directory.api.response;

import java.time.Instant;

public record VerificationResponse(String identityId, String displayName, Instant verifiedAt) {}
