package com.resumeai.domain.rewrite.model;

/**
 * Raw generation output plus token accounting.
 */
public record GenerationResult(
        String content,
        String model,
        long promptTokens,
        long completionTokens
) {
}
