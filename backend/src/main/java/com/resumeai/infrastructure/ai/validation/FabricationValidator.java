package com.resumeai.infrastructure.ai.validation;

import com.resumeai.domain.rewrite.model.*;
import com.resumeai.infrastructure.ai.evidence.EvidenceMaps;
import com.resumeai.infrastructure.ai.planning.MetricDetector;
import com.resumeai.infrastructure.ai.planning.VerbMapper;
import com.resumeai.infrastructure.config.RewriteProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Rule-based fabrication validator for rewritten text.
 * Every new claim in the improved text must trace back to the original or the evidence ledger.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FabricationValidator {

    private final ClaimExtractor claimExtractor;
    private final MetricDetector metricDetector;
    private final VerbMapper verbMapper;
    private final RewriteProperties properties;

    /**
     * Validate a bullet rewrite against the default bullet length cap.
     */
    public ValidationResult validateRewrite(String original,
                                            String improved,
                                            EvidenceLedger ledger,
                                            List<EvidenceMapItem> evidenceMap) {
        return validateRewrite(original, improved, ledger, evidenceMap, properties.thresholds().maxBulletLength());
    }

    /**
     * Validate a rewrite against every rule.
     *
     * @param original    the text before rewriting
     * @param improved    the generated text
     * @param ledger      the evidence the rewrite may draw from
     * @param evidenceMap spans of {@code improved} with the ledger ids that support them
     * @param maxLength   hard length cap for {@code improved}
     * @return every finding; passed iff none is critical
     */
    public ValidationResult validateRewrite(String original,
                                            String improved,
                                            EvidenceLedger ledger,
                                            List<EvidenceMapItem> evidenceMap,
                                            int maxLength) {
        List<EvidenceMapItem> map = evidenceMap == null ? List.of() : evidenceMap;
        List<ValidationItem> items = new ArrayList<>(validateEvidenceMap(original, improved, map, ledger));

        checkNewNumbers(original, improved, ledger, items);
        checkNewTools(original, improved, ledger, items);
        checkNewCompanies(original, improved, ledger, items);
        checkScaleClaims(original, improved, ledger, items);
        checkLengthExplosion(original, improved, maxLength, items);
        checkWeakVerb(improved, items);
        if (properties.features().meaningShiftCheck()) {
            checkOverlap(original, improved, items);
        }

        ValidationResult result = ValidationResult.of(items);
        if (!items.isEmpty()) {
            log.info("Rewrite validation completed: {} items ({} critical, {} warnings)",
                    items.size(), result.criticalErrors().size(), result.warnings().size());
        }
        return result;
    }

    /**
     * Structural checks of the evidence map itself: ids resolve, spans exist, claims are covered.
     */
    public List<ValidationItem> validateEvidenceMap(String original,
                                                    String improved,
                                                    List<EvidenceMapItem> evidenceMap,
                                                    EvidenceLedger ledger) {
        List<ValidationItem> items = new ArrayList<>();
        boolean anchored = properties.features().evidenceAnchoredRewrite();

        for (String unknownId : EvidenceMaps.findUnknownEvidenceIds(evidenceMap, ledger)) {
            items.add(ValidationItem.critical(ValidationCode.INVALID_EVIDENCE_ID,
                    "Evidence id \"" + unknownId + "\" does not exist in the ledger (valid ids: "
                            + String.join(", ", ledger.ids()) + ")"));
        }

        String improvedLower = improved.toLowerCase(Locale.ROOT);
        for (EvidenceMapItem item : evidenceMap) {
            String span = item.improvedSpan().trim();
            if (span.isEmpty() || !improvedLower.contains(span.toLowerCase(Locale.ROOT))) {
                items.add(ValidationItem.critical(ValidationCode.SPAN_NOT_FOUND,
                        "Mapped span \"" + span + "\" does not appear in the improved text"));
                continue;
            }
            checkEvidenceMatch(item, ledger, items);
        }

        if (!anchored) {
            return items;
        }

        if (evidenceMap.isEmpty() && !improved.trim().equals(original.trim())) {
            items.add(ValidationItem.critical(ValidationCode.EMPTY_EVIDENCE_MAP,
                    "Rewritten text has no evidence map; every changed claim must cite ledger ids"));
        }

        for (String term : claimExtractor.extractTechTerms(improved)) {
            if (!EvidenceMaps.isSpanMapped(evidenceMap, term) && !claimExtractor.mentionsTerm(original, term)) {
                items.add(ValidationItem.critical(ValidationCode.UNSUPPORTED_TOOL_CLAIM,
                        "Tool \"" + term + "\" is not covered by any evidence map span"));
            }
        }

        Set<Double> originalValues = metricDetector.extractAllNumberValues(List.of(original));
        for (String number : metricDetector.extractNumbers(improved)) {
            boolean inOriginal = original.contains(number)
                    || originalValues.contains(MetricDetector.normalizeNumber(number));
            if (!inOriginal && !EvidenceMaps.isSpanMapped(evidenceMap, number)) {
                items.add(ValidationItem.critical(ValidationCode.UNSUPPORTED_METRIC_CLAIM,
                        "Number \"" + number + "\" is not covered by any evidence map span"));
            }
        }
        return items;
    }

    public static List<ValidationItem> getCriticalErrors(ValidationResult result) {
        return result.criticalErrors();
    }

    public static List<ValidationItem> getWarnings(ValidationResult result) {
        return result.warnings();
    }

    public static boolean hasFabricationErrors(ValidationResult result) {
        return result.hasFabricationErrors();
    }

    /**
     * Human-readable report, critical items first.
     */
    public static String formatValidationResult(ValidationResult result) {
        if (result.items().isEmpty()) {
            return "PASSED: no issues";
        }
        StringBuilder sb = new StringBuilder(result.passed() ? "PASSED" : "FAILED")
                .append(" (").append(result.criticalErrors().size()).append(" critical, ")
                .append(result.warnings().size()).append(" warnings)\n");
        for (ValidationItem item : result.criticalErrors()) {
            sb.append("[CRITICAL] ").append(item.code()).append(": ").append(item.message()).append("\n");
        }
        for (ValidationItem item : result.warnings()) {
            sb.append("[WARNING] ").append(item.code()).append(": ").append(item.message()).append("\n");
        }
        return sb.toString().trim();
    }

    // Weak mapping: cited evidence barely shares words with the span
    private void checkEvidenceMatch(EvidenceMapItem item, EvidenceLedger ledger, List<ValidationItem> items) {
        String evidenceText = item.evidenceIds().stream()
                .map(ledger::getEvidenceById)
                .flatMap(Optional::stream)
                .map(EvidenceItem::text)
                .collect(Collectors.joining(" "));
        if (evidenceText.isBlank()) {
            return;
        }
        if (SemanticOverlap.isSubstringMatch(item.improvedSpan(), evidenceText)) {
            return;
        }
        double threshold = properties.thresholds().evidenceOverlapThreshold();
        double ratio = SemanticOverlap.calculateOverlapRatio(item.improvedSpan(), evidenceText);
        if (ratio < threshold) {
            items.add(ValidationItem.warning(ValidationCode.WEAK_EVIDENCE_MATCH,
                    String.format(Locale.ROOT, "Span \"%s\" overlaps its evidence %s by only %.0f%%",
                            item.improvedSpan(), item.evidenceIds(), ratio * 100)));
        }
    }

    private void checkNewNumbers(String original, String improved, EvidenceLedger ledger, List<ValidationItem> items) {
        List<String> sources = new ArrayList<>(ledger.texts());
        sources.addAll(ledger.getAllNormalizedTerms());
        for (String number : metricDetector.findNewNumbers(improved, original, sources)) {
            items.add(ValidationItem.critical(ValidationCode.NEW_NUMBER_ADDED,
                    "Number \"" + number + "\" appears in neither the original text nor the evidence"));
        }
    }

    private void checkNewTools(String original, String improved, EvidenceLedger ledger, List<ValidationItem> items) {
        Set<String> ledgerTerms = ledger.getAllNormalizedTerms();
        for (String term : claimExtractor.extractTechTerms(improved)) {
            if (claimExtractor.mentionsTerm(original, term)) {
                continue;
            }
            boolean grounded = ledgerTerms.contains(term)
                    || ledger.texts().stream().anyMatch(text -> claimExtractor.mentionsTerm(text, term));
            if (!grounded) {
                items.add(ValidationItem.critical(ValidationCode.NEW_TOOL_ADDED,
                        "Tool \"" + term + "\" is not in the evidence ledger"));
            }
        }
    }

    private void checkNewCompanies(String original, String improved, EvidenceLedger ledger, List<ValidationItem> items) {
        String originalLower = original.toLowerCase(Locale.ROOT);
        for (String company : claimExtractor.extractCompanies(improved)) {
            String lower = company.toLowerCase(Locale.ROOT);
            boolean known = originalLower.contains(lower)
                    || ledger.texts().stream().anyMatch(text -> text.toLowerCase(Locale.ROOT).contains(lower));
            if (!known) {
                items.add(ValidationItem.critical(ValidationCode.NEW_COMPANY_ADDED,
                        "Company \"" + company + "\" is not mentioned in the original text or evidence"));
            }
        }
    }

    private void checkScaleClaims(String original, String improved, EvidenceLedger ledger, List<ValidationItem> items) {
        for (String claim : metricDetector.findNewScaleClaims(improved, original, ledger.texts())) {
            items.add(ValidationItem.critical(ValidationCode.UNSUPPORTED_SCALE_CLAIM,
                    "Scale claim \"" + claim + "\" is not supported by the original text or evidence"));
        }
    }

    private void checkLengthExplosion(String original, String improved, int maxLength, List<ValidationItem> items) {
        double multiplier = properties.thresholds().maxLengthMultiplier();
        int originalLength = Math.max(original.trim().length(), 1);
        int improvedLength = improved.trim().length();
        if (improvedLength > maxLength) {
            items.add(ValidationItem.warning(ValidationCode.LENGTH_EXPLOSION,
                    "Improved text is " + improvedLength + " chars, over the " + maxLength + " char limit"));
        } else if (improvedLength > originalLength * multiplier) {
            items.add(ValidationItem.warning(ValidationCode.LENGTH_EXPLOSION,
                    String.format(Locale.ROOT, "Improved text grew %.1fx (limit %.1fx)",
                            (double) improvedLength / originalLength, multiplier)));
        }
    }

    private void checkWeakVerb(String improved, List<ValidationItem> items) {
        if (verbMapper.startsWithWeakVerb(improved)) {
            items.add(ValidationItem.warning(ValidationCode.WEAK_VERB,
                    "Improved text still starts with a weak verb"));
        }
    }

    private void checkOverlap(String original, String improved, List<ValidationItem> items) {
        double jaccard = SemanticOverlap.jaccardSimilarity(original, improved);
        double coefficient = SemanticOverlap.overlapCoefficient(original, improved);
        if (jaccard < properties.thresholds().lowOverlapMin()) {
            items.add(ValidationItem.warning(ValidationCode.LOW_OVERLAP,
                    String.format(Locale.ROOT, "Improved text shares little with the original (jaccard %.2f, overlap %.2f)",
                            jaccard, coefficient)));
        }
    }
}
