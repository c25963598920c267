package com.resumeai.infrastructure.ai.pipeline;

import com.resumeai.domain.rewrite.exception.RewriteException;
import com.resumeai.domain.rewrite.model.*;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one rewrite request as it moves through plan, generate, validate and retry.
 * Ledger and plan are never replaced between attempts; only prompt and temperature change.
 */
@Data
public class RewritePipelineContext {

    // --- Input ---
    private RewriteType type;
    private RewriteType temperatureType;
    private String original;
    private EvidenceLedger ledger;
    private RewritePlan plan;
    private String targetRole;
    private int maxLength;

    // --- Prompt ---
    private String systemPrompt;
    private String userMessage;
    private double temperature;

    // --- Attempts ---
    private RewriteState state = RewriteState.PLANNED;
    private int attempts;
    private String rawOutput;
    private Attempt lastAttempt;
    private Attempt bestAttempt;
    private RewriteException lastFailure;
    private List<String> history = new ArrayList<>();

    /**
     * Keep the attempt with the fewest critical items; the later one wins a tie.
     */
    public void recordAttempt(Attempt attempt) {
        lastAttempt = attempt;
        if (bestAttempt == null
                || attempt.validation().criticalErrors().size() <= bestAttempt.validation().criticalErrors().size()) {
            bestAttempt = attempt;
        }
        history.add("#" + attempt.number() + " " + (attempt.validation().passed() ? "passed" : "failed")
                + " critical=" + attempt.validation().criticalErrors().size());
    }

    public RewriteResult toRewriteResult() {
        Attempt best = bestAttempt;
        boolean passed = best.validation().passed();
        return new RewriteResult(
                type,
                original,
                best.improved(),
                best.evidenceMap(),
                best.validation(),
                best.reasoning(),
                best.changes(),
                confidence(passed, best.validation()),
                passed ? RewriteStatus.PASSED : RewriteStatus.EXHAUSTED,
                attempts,
                passed ? estimateScoreGain(best.changes(), attempts > 1) : 0,
                plan.needsUserInput()
        );
    }

    private ConfidenceLevel confidence(boolean passed, ValidationResult validation) {
        if (!passed) {
            return ConfidenceLevel.LOW;
        }
        return attempts == 1 && validation.items().isEmpty() ? ConfidenceLevel.HIGH : ConfidenceLevel.MEDIUM;
    }

    static int estimateScoreGain(RewriteChanges changes, boolean retried) {
        int gain = 0;
        if (changes.strongerVerb()) gain += 2;
        if (changes.addedMetric()) gain += 2;
        if (changes.moreSpecific()) gain += 2;
        if (changes.removedFluff()) gain += 1;
        if (changes.tailoredToRole()) gain += 1;
        if (retried) gain -= 1;
        return Math.max(0, Math.min(gain, 10));
    }

    public enum RewriteState {
        PLANNED,
        GENERATED,
        VALIDATING,
        PASSED,
        RETRYING,
        EXHAUSTED
    }

    /**
     * One validated generation.
     */
    public record Attempt(
            int number,
            String improved,
            List<EvidenceMapItem> evidenceMap,
            String reasoning,
            RewriteChanges changes,
            ValidationResult validation
    ) {}
}
