package com.resumeai.domain.rewrite.model;

import jakarta.validation.constraints.NotBlank;

public record SummaryRewriteRequest(
        @NotBlank(message = "Summary text is required")
        String summary,
        String targetRole,
        Layer1Signals layer1,
        EvidenceScope evidenceScope,
        Boolean allowResumeEnrichment
) implements RewriteRequest {

    @Override
    public RewriteType type() {
        return RewriteType.SUMMARY;
    }
}
