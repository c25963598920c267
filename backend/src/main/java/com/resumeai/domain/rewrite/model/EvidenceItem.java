package com.resumeai.domain.rewrite.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * An atomic fact that can ground a claim in rewritten text.
 *
 * @param id              unique id within a ledger (E1, E2, E_skills, ...)
 * @param type            what kind of content the item came from
 * @param text            raw evidence text
 * @param normalizedTerms lower-cased terms used for grounding checks
 */
public record EvidenceItem(
        String id,
        EvidenceType type,
        String text,
        Set<String> normalizedTerms
) {
    public EvidenceItem {
        text = text == null ? "" : text;
        normalizedTerms = normalizedTerms == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(normalizedTerms));
    }

    /**
     * Case-insensitive match against the normalized terms first, then the raw text.
     */
    public boolean mentions(String term) {
        if (term == null || term.isBlank()) {
            return false;
        }
        String lower = term.toLowerCase(Locale.ROOT).trim();
        return normalizedTerms.contains(lower) || text.toLowerCase(Locale.ROOT).contains(lower);
    }
}
