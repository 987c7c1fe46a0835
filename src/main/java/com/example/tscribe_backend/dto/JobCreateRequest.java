package com.example.tscribe_backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record JobCreateRequest(
        @NotBlank @Size(max = 2048) String url,
        @Size(max = 16) @Pattern(regexp = "^[A-Za-z]{2,3}([-_][A-Za-z0-9]{2,8})*$", message = "invalid language code")
        String language
) {}
