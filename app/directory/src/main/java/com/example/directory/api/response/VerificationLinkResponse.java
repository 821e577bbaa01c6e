package com.example.directory.api.response;

public record VerificationLinkResponse(String url) {}
