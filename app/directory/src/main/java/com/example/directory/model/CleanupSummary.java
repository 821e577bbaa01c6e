package com.example.directory.model;

public record CleanupSummary(int checked, int removed) {}
