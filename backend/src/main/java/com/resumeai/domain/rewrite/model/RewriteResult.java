package com.resumeai.domain.rewrite.model;

import java.util.List;

/**
 * Outcome of a bullet or summary rewrite. Not mutated after it is returned.
 *
 * @param type               bullet or summary
 * @param original           text that was rewritten
 * @param improved           generated text (may equal the original when skipped)
 * @param evidenceMap        span to evidence id traceability
 * @param validation         verdict of the last validated attempt
 * @param reasoning          generator's explanation
 * @param changes            change flags reported by the generator
 * @param confidence         overall confidence in the rewrite
 * @param status             PASSED, EXHAUSTED (attempt budget consumed) or SKIPPED (no generation)
 * @param attempts           generation attempts made
 * @param estimatedScoreGain 0..10 estimate, 0 unless validation passed
 * @param needsUserInput     questions for facts the ledger could not supply
 */
public record RewriteResult(
        RewriteType type,
        String original,
        String improved,
        List<EvidenceMapItem> evidenceMap,
        ValidationResult validation,
        String reasoning,
        RewriteChanges changes,
        ConfidenceLevel confidence,
        RewriteStatus status,
        int attempts,
        int estimatedScoreGain,
        List<UserInputRequest> needsUserInput
) implements RewriteOutput {
    public RewriteResult {
        evidenceMap = evidenceMap == null ? List.of() : List.copyOf(evidenceMap);
        needsUserInput = needsUserInput == null ? List.of() : List.copyOf(needsUserInput);
        changes = changes == null ? RewriteChanges.none() : changes;
    }

    public boolean passed() {
        return validation != null && validation.passed();
    }
}
