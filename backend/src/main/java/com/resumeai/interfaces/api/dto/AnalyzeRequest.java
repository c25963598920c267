package com.resumeai.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnalyzeRequest(
        @NotBlank(message = "Text is required")
        @Size(max = 2000, message = "Text must not exceed 2000 characters")
        String text
) {}
