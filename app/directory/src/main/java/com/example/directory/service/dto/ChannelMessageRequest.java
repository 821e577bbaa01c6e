package com.example.directory.service.dto;

public record ChannelMessageRequest(String content) {}
