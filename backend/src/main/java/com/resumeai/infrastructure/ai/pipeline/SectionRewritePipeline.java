package com.resumeai.infrastructure.ai.pipeline;

import com.resumeai.domain.rewrite.model.*;
import com.resumeai.domain.rewrite.service.GenerationBackend;
import com.resumeai.infrastructure.ai.coherence.FormatUnifier;
import com.resumeai.infrastructure.ai.coherence.TenseUnifier;
import com.resumeai.infrastructure.ai.planning.MicroActionPlanner;
import com.resumeai.infrastructure.config.RewriteProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Rewrites every bullet of a section against one shared ledger, then runs the coherence pass:
 * tense unification, formatting and ATS-safe characters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SectionRewritePipeline {

    private final MicroActionPlanner planner;
    private final RewritePipeline rewritePipeline;
    private final GenerationBackend generationBackend;
    private final TenseUnifier tenseUnifier;
    private final FormatUnifier formatUnifier;
    private final RewriteProperties properties;

    public SectionRewriteResult rewriteSection(SectionRewriteRequest request, EvidenceLedger ledger) {
        List<String> bullets = request.bullets();
        SectionType sectionType = request.sectionType() == null ? SectionType.EXPERIENCE : request.sectionType();
        Layer1Signals layer1 = request.layer1() == null ? Layer1Signals.empty() : request.layer1();
        TenseDetection detection = tenseUnifier.detectDominantTense(bullets);
        boolean generate = generationBackend.isAvailable();

        log.info("Section rewrite - bullets: {}, sectionType: {}, dominantTense: {} ({}), generate: {}",
                bullets.size(), sectionType.value(), detection.tense().value(), detection.confidence().value(), generate);

        List<SectionBulletDetail> details = new ArrayList<>();
        List<String> improved = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        Set<String> usedStarts = new HashSet<>();

        for (int i = 0; i < bullets.size(); i++) {
            String bullet = bullets.get(i);
            BulletContext context = new BulletContext(sectionType, request.role(), request.company(), i);
            RewritePlan plan = planner.plan(bullet, ledger, layer1.issuesFor(bullet, i),
                    context, request.targetRole(), bullets);

            Tense tense = tenseUnifier.detectBulletTense(bullet);
            if (tense != Tense.OTHER && tense != detection.tense()) {
                plan = plan.withAction(MicroAction.tenseAlign(detection.tense()));
            }

            RewriteResult result = generate
                    ? rewritePipeline.rewriteBullet(bullet, ledger, plan, request.targetRole(), RewriteType.SECTION)
                    : RewritePipeline.skipped(RewriteType.BULLET, bullet, ledger, plan);

            String startWord = formatUnifier.getStartWord(result.improved()).toLowerCase(Locale.ROOT);
            if (!startWord.isEmpty() && !usedStarts.add(startWord)) {
                String note = "Bullet " + (i + 1) + " starts with repeated word \"" + startWord + "\"";
                note += formatUnifier.getAlternativeStart(startWord, usedStarts)
                        .map(alt -> " (consider \"" + alt + "\")")
                        .orElse("");
                notes.add(note);
            }

            details.add(new SectionBulletDetail(i, result));
            improved.add(result.improved());
        }

        if (!formatUnifier.hasVariedStarts(improved)) {
            notes.add("Many bullets open with the same word");
        }

        List<String> finalBullets = improved;
        if (properties.features().sectionCoherencePass()) {
            List<String> unified = tenseUnifier.unifyTense(improved, detection.tense());
            if (!unified.equals(improved)) {
                notes.add("Unified tense to " + detection.tense().value());
            }
            finalBullets = formatUnifier.applyFullFormattingToAll(unified);
            if (!finalBullets.equals(unified)) {
                notes.add("Applied consistent formatting");
            }
        }

        SectionRewriteResult result = new SectionRewriteResult(
                bullets,
                finalBullets,
                details,
                summarizeValidation(details),
                notes,
                detection.tense(),
                overallConfidence(details),
                details.stream().mapToInt(d -> d.bulletResult().estimatedScoreGain()).sum());

        log.info("Section rewrite done - passed: {}, notes: {}, gain: {}",
                result.validationSummary().passed(), notes.size(), result.estimatedAggregateGain());
        return result;
    }

    /**
     * Passes only if every bullet passed; items carry the bullet number.
     */
    private ValidationResult summarizeValidation(List<SectionBulletDetail> details) {
        List<ValidationItem> items = new ArrayList<>();
        boolean passed = true;
        for (SectionBulletDetail detail : details) {
            ValidationResult validation = detail.bulletResult().validation();
            passed &= validation.passed();
            String prefix = "Bullet " + (detail.index() + 1) + ": ";
            validation.items().forEach(item -> items.add(item.withMessagePrefix(prefix)));
        }
        return new ValidationResult(passed, items);
    }

    private ConfidenceLevel overallConfidence(List<SectionBulletDetail> details) {
        List<ConfidenceLevel> levels = details.stream().map(d -> d.bulletResult().confidence()).toList();
        if (levels.contains(ConfidenceLevel.LOW)) {
            return ConfidenceLevel.LOW;
        }
        return levels.stream().allMatch(c -> c == ConfidenceLevel.HIGH) ? ConfidenceLevel.HIGH : ConfidenceLevel.MEDIUM;
    }
}
