package com.resumeai.interfaces.api.dto;

import com.resumeai.domain.rewrite.model.Layer1Signals;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ParallelRewriteRequest(
        @NotEmpty(message = "At least one bullet is required")
        @Size(max = 20, message = "At most 20 bullets can be rewritten at once")
        List<@NotBlank(message = "Bullet text is required") String> bullets,

        Layer1Signals layer1,

        @Size(max = 100, message = "Target role must not exceed 100 characters")
        String targetRole
) {}
