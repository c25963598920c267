package com.resumeai.domain.rewrite.model;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record SectionRewriteRequest(
        @NotEmpty(message = "At least one bullet is required")
        List<String> bullets,
        String sectionTitle,
        SectionType sectionType,
        String role,
        String company,
        String targetRole,
        Layer1Signals layer1,
        EvidenceScope evidenceScope,
        Boolean allowResumeEnrichment
) implements RewriteRequest {

    public static SectionRewriteRequest of(List<String> bullets, Layer1Signals layer1) {
        return new SectionRewriteRequest(bullets, null, SectionType.EXPERIENCE, null, null, null,
                layer1, null, null);
    }

    @Override
    public RewriteType type() {
        return RewriteType.SECTION;
    }
}
