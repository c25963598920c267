package com.resumeai.domain.rewrite.model;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record BulletRewriteRequest(
        @NotBlank(message = "Bullet text is required")
        String bullet,
        List<String> issues,
        Layer1Signals layer1,
        String targetRole,
        BulletContext context,
        EvidenceScope evidenceScope,
        Boolean allowResumeEnrichment,
        List<String> sectionBullets
) implements RewriteRequest {
    public BulletRewriteRequest {
        issues = issues == null ? List.of() : List.copyOf(issues);
        sectionBullets = sectionBullets == null ? List.of() : List.copyOf(sectionBullets);
    }

    public static BulletRewriteRequest of(String bullet) {
        return of(bullet, ExtractedEntities.empty());
    }

    public static BulletRewriteRequest of(String bullet, ExtractedEntities entities) {
        return new BulletRewriteRequest(bullet, List.of(), Layer1Signals.of(entities),
                null, null, null, null, List.of());
    }

    @Override
    public RewriteType type() {
        return RewriteType.BULLET;
    }
}
