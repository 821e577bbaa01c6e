package com.example.directory.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PageRedeemRequest(@NotBlank @Size(max = 100) String token) {}
