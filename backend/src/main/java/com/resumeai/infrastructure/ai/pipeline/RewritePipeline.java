package com.resumeai.infrastructure.ai.pipeline;

import com.resumeai.domain.rewrite.exception.RewriteErrorCode;
import com.resumeai.domain.rewrite.exception.RewriteException;
import com.resumeai.domain.rewrite.model.*;
import com.resumeai.domain.rewrite.service.GenerationBackend;
import com.resumeai.infrastructure.ai.AiGenerationException;
import com.resumeai.infrastructure.ai.PromptBuilder;
import com.resumeai.infrastructure.ai.RewritePrompt;
import com.resumeai.infrastructure.ai.TemperatureSchedule;
import com.resumeai.infrastructure.ai.evidence.EvidenceMaps;
import com.resumeai.infrastructure.ai.parsing.RewriteResponseParser;
import com.resumeai.infrastructure.ai.parsing.RewriteResponseParser.ParsedRewrite;
import com.resumeai.infrastructure.ai.pipeline.RewritePipelineContext.Attempt;
import com.resumeai.infrastructure.ai.pipeline.RewritePipelineContext.RewriteState;
import com.resumeai.infrastructure.ai.validation.FabricationValidator;
import com.resumeai.infrastructure.config.RewriteProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Retry controller for a single bullet or summary:
 * <p>
 * prompt -> generate -> parse -> validate -> (passed | retry with stricter prompt | exhausted)
 * </p>
 * The attempt budget is shared by validation failures and backend failures.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RewritePipeline {

    private final GenerationBackend generationBackend;
    private final PromptBuilder promptBuilder;
    private final RewriteResponseParser responseParser;
    private final FabricationValidator fabricationValidator;
    private final TemperatureSchedule temperatureSchedule;
    private final RewriteProperties properties;

    public RewriteResult rewriteBullet(String original, EvidenceLedger ledger, RewritePlan plan, String targetRole) {
        return rewriteBullet(original, ledger, plan, targetRole, RewriteType.BULLET);
    }

    /**
     * @param temperatureType BULLET for a standalone bullet, SECTION for a bullet rewritten as part of a section
     */
    public RewriteResult rewriteBullet(String original,
                                       EvidenceLedger ledger,
                                       RewritePlan plan,
                                       String targetRole,
                                       RewriteType temperatureType) {
        RewritePipelineContext ctx = newContext(RewriteType.BULLET, temperatureType, original, ledger, plan, targetRole);
        RewritePrompt prompt = temperatureType == RewriteType.SECTION
                ? promptBuilder.buildSectionBulletPrompt(original, ledger, plan, targetRole)
                : promptBuilder.buildBulletPrompt(original, ledger, plan, targetRole);
        return execute(ctx, promptBuilder.addExamplesToPrompt(prompt));
    }

    public RewriteResult rewriteSummary(String summary, EvidenceLedger ledger, RewritePlan plan, String targetRole) {
        RewritePipelineContext ctx = newContext(RewriteType.SUMMARY, RewriteType.SUMMARY, summary, ledger, plan, targetRole);
        return execute(ctx, promptBuilder.buildSummaryPrompt(summary, ledger, plan, targetRole));
    }

    /**
     * Result used when no generation is attempted: the text comes back unchanged, citing itself.
     */
    public static RewriteResult skipped(RewriteType type, String original, EvidenceLedger ledger, RewritePlan plan) {
        String selfId = ledger.items().stream()
                .filter(item -> item.text().equals(original))
                .map(EvidenceItem::id)
                .findFirst()
                .orElse(ledger.ids().get(0));
        return new RewriteResult(
                type,
                original,
                original,
                List.of(new EvidenceMapItem(original, List.of(selfId))),
                ValidationResult.clean(),
                "Generation backend unavailable; original text returned unchanged",
                RewriteChanges.none(),
                ConfidenceLevel.LOW,
                RewriteStatus.SKIPPED,
                0,
                0,
                plan == null ? List.of() : plan.needsUserInput());
    }

    // ===== Internal methods =====

    private RewritePipelineContext newContext(RewriteType type,
                                              RewriteType temperatureType,
                                              String original,
                                              EvidenceLedger ledger,
                                              RewritePlan plan,
                                              String targetRole) {
        RewritePipelineContext ctx = new RewritePipelineContext();
        ctx.setType(type);
        ctx.setTemperatureType(temperatureType);
        ctx.setOriginal(original);
        ctx.setLedger(ledger);
        ctx.setPlan(plan);
        ctx.setTargetRole(targetRole);
        ctx.setMaxLength(plan.constraints().maxLength());
        return ctx;
    }

    private RewriteResult execute(RewritePipelineContext ctx, RewritePrompt initialPrompt) {
        int maxAttempts = 1 + Math.max(0, properties.llm().maxRetries());
        log.info("Rewrite started - type: {}, plan: {}, ledger: {}, prompt: ~{} tokens",
                ctx.getType(), ctx.getPlan().actionTypes(), ctx.getLedger().ids(),
                PromptBuilder.estimateTokenCount(initialPrompt.system() + initialPrompt.user()));

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            RewritePrompt prompt = promptForAttempt(ctx, initialPrompt);
            ctx.setSystemPrompt(prompt.system());
            ctx.setUserMessage(prompt.user());
            ctx.setTemperature(temperatureSchedule.clampTemperature(ctx.getTemperatureType(),
                    temperatureSchedule.getTemperatureForAttempt(ctx.getTemperatureType(), attempt)));
            ctx.setAttempts(attempt + 1);

            Optional<ParsedRewrite> parsed = generate(ctx);
            if (parsed.isEmpty()) {
                continue;
            }

            ctx.setState(RewriteState.VALIDATING);
            ParsedRewrite rewrite = parsed.get();
            ValidationResult validation = fabricationValidator.validateRewrite(
                    ctx.getOriginal(), rewrite.improved(), ctx.getLedger(), rewrite.evidenceMap(), ctx.getMaxLength());
            ctx.recordAttempt(new Attempt(attempt + 1, rewrite.improved(), rewrite.evidenceMap(),
                    rewrite.reasoning(), rewrite.changes(), validation));

            if (validation.passed()) {
                ctx.setState(RewriteState.PASSED);
                log.info("Rewrite passed on attempt {} ({} warnings, evidence coverage {})", attempt + 1,
                        validation.warnings().size(),
                        String.format("%.2f", EvidenceMaps.calculateEvidenceCoverage(rewrite.improved(), rewrite.evidenceMap())));
                log.debug("Evidence map:\n{}", EvidenceMaps.formatEvidenceMap(rewrite.evidenceMap()));
                break;
            }

            log.warn("Rewrite attempt {} rejected:\n{}", attempt + 1,
                    FabricationValidator.formatValidationResult(validation));
            if (!properties.features().retryOnValidationFailure()) {
                break;
            }
            ctx.setState(RewriteState.RETRYING);
        }

        if (ctx.getBestAttempt() == null) {
            RewriteException failure = ctx.getLastFailure();
            log.warn("Rewrite failed without a usable attempt after {} tries", ctx.getAttempts());
            throw failure != null
                    ? failure
                    : new RewriteException(RewriteErrorCode.INTERNAL_ERROR, "Rewrite produced no attempt");
        }
        if (ctx.getState() != RewriteState.PASSED) {
            ctx.setState(RewriteState.EXHAUSTED);
            log.warn("Rewrite exhausted after {} attempts, history: {}", ctx.getAttempts(), ctx.getHistory());
        }
        return ctx.toRewriteResult();
    }

    /**
     * First attempt uses the plan prompt. After a rejected rewrite, the retry prompt lists its
     * critical errors under strict constraints; after a backend failure the previous prompt is reused.
     */
    private RewritePrompt promptForAttempt(RewritePipelineContext ctx, RewritePrompt initialPrompt) {
        if (ctx.getState() != RewriteState.RETRYING || ctx.getLastAttempt() == null) {
            return ctx.getSystemPrompt() == null
                    ? initialPrompt
                    : new RewritePrompt(ctx.getSystemPrompt(), ctx.getUserMessage());
        }
        RewritePrompt retry = promptBuilder.buildRetryPrompt(
                ctx.getOriginal(), ctx.getLedger(),
                ctx.getLastAttempt().validation().criticalErrors(), initialPrompt.system());
        return promptBuilder.addStrictConstraintsToPrompt(retry);
    }

    private Optional<ParsedRewrite> generate(RewritePipelineContext ctx) {
        try {
            GenerationResult result = generationBackend.generate(
                    new GenerationRequest(ctx.getSystemPrompt(), ctx.getUserMessage(), ctx.getTemperature()));
            ctx.setState(RewriteState.GENERATED);
            ctx.setRawOutput(result.content());
        } catch (RewriteException e) {
            if (!e.isRetryable()) {
                throw e;
            }
            ctx.setLastFailure(e);
            ctx.getHistory().add("#" + ctx.getAttempts() + " " + e.getCode());
            log.warn("Generation attempt {} failed: {} - {}", ctx.getAttempts(), e.getCode(), e.getMessage());
            return Optional.empty();
        }

        Optional<ParsedRewrite> parsed = responseParser.parseOrFallback(ctx.getRawOutput());
        if (parsed.isEmpty()) {
            ctx.setLastFailure(new AiGenerationException(RewriteErrorCode.LLM_ERROR,
                    "Generation response could not be parsed"));
            ctx.getHistory().add("#" + ctx.getAttempts() + " unparseable");
            log.warn("Generation attempt {} returned unparseable output ({} chars)",
                    ctx.getAttempts(), ctx.getRawOutput() == null ? 0 : ctx.getRawOutput().length());
        } else if (parsed.get().fallback()) {
            ctx.getHistory().add("#" + ctx.getAttempts() + " fallback");
        }
        return parsed;
    }
}
