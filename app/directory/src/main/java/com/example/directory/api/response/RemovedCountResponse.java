package com.example.directory.api.response;

public record RemovedCountResponse(int removed) {}
