package com.resumeai.domain.rewrite.model;

/**
 * Dominant tense of a set of bullets, with the vote counts behind it.
 */
public record TenseDetection(
        Tense tense,
        ConfidenceLevel confidence,
        int pastCount,
        int presentCount
) {
}
