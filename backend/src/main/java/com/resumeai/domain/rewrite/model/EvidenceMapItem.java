package com.resumeai.domain.rewrite.model;

import java.util.List;

/**
 * Asserts that a span of the improved text is supported by the referenced evidence.
 */
public record EvidenceMapItem(
        String improvedSpan,
        List<String> evidenceIds
) {
    public EvidenceMapItem {
        improvedSpan = improvedSpan == null ? "" : improvedSpan;
        evidenceIds = evidenceIds == null ? List.of() : List.copyOf(evidenceIds);
    }
}
