package com.resumeai.infrastructure.ai.evidence;

import com.resumeai.domain.rewrite.exception.RewriteErrorCode;
import com.resumeai.domain.rewrite.exception.RewriteException;
import com.resumeai.domain.rewrite.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Builds the closed evidence ledger for a rewrite request.
 * Pure and deterministic: identical inputs yield identical ids and ordering.
 */
@Slf4j
@Component
public class EvidenceLedgerBuilder {

    public static final String SKILLS_EVIDENCE_ID = "E_skills";
    public static final String TOOLS_EVIDENCE_ID = "E_tools";
    public static final String TITLES_EVIDENCE_ID = "E_titles";
    public static final String INDUSTRIES_EVIDENCE_ID = "E_industries";

    private static final int MAX_ENTITY_LENGTH = 120;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "was", "were", "with", "that", "this", "from", "have",
            "has", "had", "but", "not", "are", "been", "can", "will", "our", "their",
            "which", "into", "also", "than", "them", "its", "over", "such", "more",
            "other", "some", "about"
    );

    public EvidenceLedger buildEvidenceLedger(String bullet, ExtractedEntities entities) {
        return buildEvidenceLedger(bullet, List.of(), EvidenceScope.SECTION, true, entities);
    }

    /**
     * Ledger for a single bullet: E1 is the bullet, sibling bullets follow unless the scope
     * is bullet-only, then one item per non-empty entity category.
     */
    public EvidenceLedger buildEvidenceLedger(String bullet,
                                              List<String> sectionBullets,
                                              EvidenceScope scope,
                                              boolean allowResumeEnrichment,
                                              ExtractedEntities entities) {
        EvidenceScope actualScope = scope == null ? EvidenceScope.SECTION : scope;
        String text = bullet == null ? "" : bullet;

        List<EvidenceItem> items = new ArrayList<>();
        int counter = 1;
        items.add(textItem(nextId(counter++), EvidenceType.BULLET, text));

        if (actualScope != EvidenceScope.BULLET_ONLY && sectionBullets != null) {
            for (String sibling : sectionBullets) {
                if (sibling != null && !sibling.isBlank() && !sibling.equals(text)) {
                    items.add(textItem(nextId(counter++), EvidenceType.SECTION, sibling));
                }
            }
        }

        if (allowResumeEnrichment) {
            items.addAll(entityItems(entities));
        }

        EvidenceLedger ledger = new EvidenceLedger(items, actualScope, allowResumeEnrichment);
        log.debug("Built bullet ledger - items: {}, scope: {}", ledger.ids(), actualScope);
        return ledger;
    }

    public EvidenceLedger buildSummaryEvidenceLedger(String summary,
                                                     ExtractedEntities entities,
                                                     boolean allowResumeEnrichment) {
        List<EvidenceItem> items = new ArrayList<>();
        items.add(textItem(nextId(1), EvidenceType.BULLET, summary == null ? "" : summary));
        if (allowResumeEnrichment) {
            items.addAll(entityItems(entities));
        }
        return new EvidenceLedger(items, EvidenceScope.RESUME, allowResumeEnrichment);
    }

    /**
     * Ledger shared by every bullet of a section: E1..En are the bullets themselves.
     */
    public EvidenceLedger buildSectionEvidenceLedger(List<String> bullets,
                                                     ExtractedEntities entities,
                                                     EvidenceScope scope,
                                                     boolean allowResumeEnrichment) {
        List<EvidenceItem> items = new ArrayList<>();
        int counter = 1;
        for (String bullet : bullets) {
            items.add(textItem(nextId(counter++), EvidenceType.SECTION, bullet == null ? "" : bullet));
        }
        if (allowResumeEnrichment) {
            items.addAll(entityItems(entities));
        }
        return new EvidenceLedger(items, scope == null ? EvidenceScope.SECTION : scope, allowResumeEnrichment);
    }

    /**
     * Whether a resume-level tool may be surfaced in a bullet of the given context.
     */
    public EnrichmentDecision allowResumeEnrichmentInBullet(BulletContext context,
                                                            String tool,
                                                            List<String> sectionBullets) {
        if (context == null || context.sectionType() == null) {
            return new EnrichmentDecision(false, "no_context_provided");
        }
        return switch (context.sectionType()) {
            case SUMMARY, SKILLS, HEADLINE -> new EnrichmentDecision(true, "summary_or_skills_section");
            case PROJECTS -> new EnrichmentDecision(true, "projects_section");
            case EXPERIENCE -> {
                String toolLower = tool.toLowerCase(Locale.ROOT);
                boolean usedInRole = sectionBullets != null && sectionBullets.stream()
                        .anyMatch(b -> b != null && b.toLowerCase(Locale.ROOT).contains(toolLower));
                yield usedInRole
                        ? new EnrichmentDecision(true, "tool_used_in_same_role")
                        : new EnrichmentDecision(false, "needs_user_confirmation");
            }
        };
    }

    /**
     * Lower-case, punctuation stripped, words of three or more letters, stop words removed.
     */
    public static Set<String> normalizeTerms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        if (text == null) {
            return terms;
        }
        String cleaned = text.toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s]", " ");
        for (String word : cleaned.split("\\s+")) {
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                terms.add(word);
            }
        }
        return terms;
    }

    private List<EvidenceItem> entityItems(ExtractedEntities entities) {
        if (entities == null) {
            return List.of();
        }
        List<EvidenceItem> items = new ArrayList<>();
        addEntityItem(items, SKILLS_EVIDENCE_ID, EvidenceType.SKILLS, entities.skills());
        addEntityItem(items, TOOLS_EVIDENCE_ID, EvidenceType.TOOLS, entities.tools());
        addEntityItem(items, TITLES_EVIDENCE_ID, EvidenceType.TITLES, entities.titles());
        addEntityItem(items, INDUSTRIES_EVIDENCE_ID, EvidenceType.INDUSTRIES, entities.industries());
        return items;
    }

    private void addEntityItem(List<EvidenceItem> items, String id, EvidenceType type, List<String> values) {
        List<String> cleaned = new ArrayList<>();
        for (String value : values) {
            if (value == null) {
                throw new RewriteException(RewriteErrorCode.EVIDENCE_BUILD_ERROR,
                        "Extracted " + type.value() + " contain a null entry");
            }
            String trimmed = value.trim();
            if (trimmed.length() > MAX_ENTITY_LENGTH || trimmed.contains("\n")) {
                throw new RewriteException(RewriteErrorCode.EVIDENCE_BUILD_ERROR,
                        "Extracted " + type.value() + " entry is not a single term: " + abbreviate(trimmed));
            }
            if (!trimmed.isEmpty()) {
                cleaned.add(trimmed);
            }
        }
        if (cleaned.isEmpty()) {
            return;
        }
        Set<String> terms = new LinkedHashSet<>();
        cleaned.forEach(v -> terms.add(v.toLowerCase(Locale.ROOT)));
        items.add(new EvidenceItem(id, type, String.join(", ", cleaned), terms));
    }

    private EvidenceItem textItem(String id, EvidenceType type, String text) {
        return new EvidenceItem(id, type, text, normalizeTerms(text));
    }

    private String nextId(int counter) {
        return "E" + counter;
    }

    private String abbreviate(String value) {
        return value.length() <= 40 ? value : value.substring(0, 40) + "...";
    }

    public record EnrichmentDecision(boolean allowed, String reason) {}
}
