package com.resumeai.domain.rewrite.model;

import java.util.List;

/**
 * Outcome of a section rewrite: every bullet rewritten, then made coherent as a set.
 */
public record SectionRewriteResult(
        List<String> originalBullets,
        List<String> improvedBullets,
        List<SectionBulletDetail> perBulletDetails,
        ValidationResult validationSummary,
        List<String> sectionNotes,
        Tense dominantTense,
        ConfidenceLevel confidence,
        int estimatedAggregateGain
) implements RewriteOutput {
    public SectionRewriteResult {
        originalBullets = List.copyOf(originalBullets);
        improvedBullets = List.copyOf(improvedBullets);
        perBulletDetails = List.copyOf(perBulletDetails);
        sectionNotes = List.copyOf(sectionNotes);
    }

    @Override
    public RewriteType type() {
        return RewriteType.SECTION;
    }
}
