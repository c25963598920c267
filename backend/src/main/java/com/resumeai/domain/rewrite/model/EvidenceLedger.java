package com.resumeai.domain.rewrite.model;

import com.resumeai.domain.rewrite.exception.RewriteErrorCode;
import com.resumeai.domain.rewrite.exception.RewriteException;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of evidence available to a single rewrite request. Read-only once built.
 */
public record EvidenceLedger(
        List<EvidenceItem> items,
        EvidenceScope scope,
        boolean allowResumeEnrichment
) {
    public EvidenceLedger {
        items = items == null ? List.of() : List.copyOf(items);
        if (items.isEmpty()) {
            throw new RewriteException(RewriteErrorCode.EVIDENCE_BUILD_ERROR,
                    "Evidence ledger must contain at least one item");
        }
        Set<String> seen = new HashSet<>();
        for (EvidenceItem item : items) {
            if (!seen.add(item.id())) {
                throw new RewriteException(RewriteErrorCode.EVIDENCE_BUILD_ERROR,
                        "Duplicate evidence id: " + item.id());
            }
        }
        scope = scope == null ? EvidenceScope.SECTION : scope;
    }

    public Optional<EvidenceItem> getEvidenceById(String id) {
        return items.stream().filter(item -> item.id().equals(id)).findFirst();
    }

    public List<EvidenceItem> getEvidenceByType(EvidenceType type) {
        return items.stream().filter(item -> item.type() == type).toList();
    }

    public boolean containsId(String id) {
        return getEvidenceById(id).isPresent();
    }

    public List<String> ids() {
        return items.stream().map(EvidenceItem::id).toList();
    }

    /**
     * Union of every item's normalized terms, in ledger order.
     */
    public Set<String> getAllNormalizedTerms() {
        Set<String> terms = new LinkedHashSet<>();
        items.forEach(item -> terms.addAll(item.normalizedTerms()));
        return terms;
    }

    public List<String> texts() {
        return items.stream().map(EvidenceItem::text).toList();
    }

    public Optional<EvidenceItem> findEvidenceForTerm(String term) {
        return items.stream().filter(item -> item.mentions(term)).findFirst();
    }

    public boolean termExistsInLedger(String term) {
        return findEvidenceForTerm(term).isPresent();
    }
}
