package com.resumeai.application.rewrite;

import com.resumeai.domain.rewrite.exception.RewriteErrorCode;
import com.resumeai.domain.rewrite.exception.RewriteException;
import com.resumeai.domain.rewrite.model.*;
import com.resumeai.domain.rewrite.service.GenerationBackend;
import com.resumeai.infrastructure.ai.evidence.EvidenceLedgerBuilder;
import com.resumeai.infrastructure.ai.pipeline.RewritePipeline;
import com.resumeai.infrastructure.ai.pipeline.SectionRewritePipeline;
import com.resumeai.infrastructure.ai.planning.FluffDetector;
import com.resumeai.infrastructure.ai.planning.MetricDetector;
import com.resumeai.infrastructure.ai.planning.MicroActionPlanner;
import com.resumeai.infrastructure.ai.planning.VerbMapper;
import com.resumeai.infrastructure.ai.preprocessing.TextNormalizer;
import com.resumeai.infrastructure.config.RewriteProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import java.util.stream.IntStream;

/**
 * Entry point of the rewrite engine: validates and normalizes input, builds the ledger and plan,
 * then hands off to the retry pipeline (or returns a skipped result when no backend is configured).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RewriteAppService {

    private final TextNormalizer textNormalizer;
    private final EvidenceLedgerBuilder ledgerBuilder;
    private final MicroActionPlanner planner;
    private final RewritePipeline rewritePipeline;
    private final SectionRewritePipeline sectionRewritePipeline;
    private final GenerationBackend generationBackend;
    private final VerbMapper verbMapper;
    private final FluffDetector fluffDetector;
    private final MetricDetector metricDetector;
    private final RewriteProperties properties;
    private final ExecutorService rewriteExecutor;

    public RewriteOutput rewrite(RewriteRequest request) {
        if (request == null) {
            throw new RewriteException(RewriteErrorCode.INVALID_INPUT, "Rewrite request is required");
        }
        return switch (request.type()) {
            case BULLET -> rewriteBullet((BulletRewriteRequest) request);
            case SUMMARY -> rewriteSummary((SummaryRewriteRequest) request);
            case SECTION -> rewriteSection((SectionRewriteRequest) request);
        };
    }

    public RewriteResult rewriteBullet(BulletRewriteRequest request) {
        String bullet = textNormalizer.normalizeBullet(requireText(request.bullet(), "Bullet text"));
        List<String> siblings = textNormalizer.normalizeBullets(nonBlank(request.sectionBullets()));

        EvidenceLedger ledger = buildLedger(() -> ledgerBuilder.buildEvidenceLedger(
                bullet, siblings, scopeOf(request), enrichmentOf(request), request.entities()));

        List<String> issues = request.issues();
        if (issues.isEmpty() && request.layer1() != null) {
            int index = request.context() != null && request.context().index() != null
                    ? request.context().index() : -1;
            issues = request.layer1().issuesFor(request.bullet(), index);
        }

        RewritePlan plan = planner.plan(bullet, ledger, issues, request.context(), request.targetRole(), siblings);
        if (!generationBackend.isAvailable()) {
            log.warn("Generation backend not configured, returning bullet unchanged");
            return RewritePipeline.skipped(RewriteType.BULLET, bullet, ledger, plan);
        }
        return rewritePipeline.rewriteBullet(bullet, ledger, plan, request.targetRole());
    }

    public RewriteResult rewriteSummary(SummaryRewriteRequest request) {
        String summary = textNormalizer.normalize(requireText(request.summary(), "Summary text"));

        EvidenceLedger ledger = buildLedger(() -> ledgerBuilder.buildSummaryEvidenceLedger(
                summary, request.entities(), enrichmentOf(request)));

        RewritePlan plan = planner.planSummary(summary, ledger, request.targetRole());
        if (!generationBackend.isAvailable()) {
            log.warn("Generation backend not configured, returning summary unchanged");
            return RewritePipeline.skipped(RewriteType.SUMMARY, summary, ledger, plan);
        }
        return rewritePipeline.rewriteSummary(summary, ledger, plan, request.targetRole());
    }

    public SectionRewriteResult rewriteSection(SectionRewriteRequest request) {
        List<String> bullets = nonBlank(request.bullets());
        if (bullets.isEmpty()) {
            throw new RewriteException(RewriteErrorCode.INVALID_INPUT, "At least one bullet is required");
        }
        int maxBullets = properties.thresholds().maxSectionBullets();
        if (bullets.size() > maxBullets) {
            throw new RewriteException(RewriteErrorCode.INVALID_INPUT,
                    String.format("A section can hold at most %d bullets", maxBullets));
        }
        bullets.forEach(b -> requireText(b, "Bullet text"));
        List<String> normalized = textNormalizer.normalizeBullets(bullets);

        EvidenceLedger ledger = buildLedger(() -> ledgerBuilder.buildSectionEvidenceLedger(
                normalized, request.entities(), scopeOf(request), enrichmentOf(request)));

        SectionRewriteRequest normalizedRequest = new SectionRewriteRequest(normalized, request.sectionTitle(),
                request.sectionType(), request.role(), request.company(), request.targetRole(),
                request.layer1(), request.evidenceScope(), request.allowResumeEnrichment());
        return sectionRewritePipeline.rewriteSection(normalizedRequest, ledger);
    }

    /**
     * Rewrite independent bullets on the bounded rewrite pool. Results keep the input order.
     * If any bullet fails, its error is rethrown once every task has finished.
     */
    public List<RewriteResult> rewriteBulletsParallel(List<BulletRewriteRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new RewriteException(RewriteErrorCode.INVALID_INPUT, "At least one bullet is required");
        }
        log.info("Parallel rewrite - bullets: {}, maxConcurrency: {}",
                requests.size(), properties.parallel().maxConcurrency());

        List<CompletableFuture<RewriteResult>> futures = requests.stream()
                .map(request -> CompletableFuture.supplyAsync(() -> rewriteBullet(request), rewriteExecutor))
                .toList();

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RewriteException rewriteException) {
                throw rewriteException;
            }
            log.error("Parallel rewrite failed", cause);
            throw new RewriteException(RewriteErrorCode.INTERNAL_ERROR, "Parallel rewrite failed", cause);
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    public List<RewriteResult> rewriteBulletsParallel(List<String> bullets, Layer1Signals layer1, String targetRole) {
        List<BulletRewriteRequest> requests = IntStream.range(0, bullets.size())
                .mapToObj(i -> new BulletRewriteRequest(bullets.get(i), List.of(), layer1, targetRole,
                        null, null, null, List.of()))
                .toList();
        return rewriteBulletsParallel(requests);
    }

    public boolean canImprove(String bullet) {
        return planner.canImprove(bullet);
    }

    public TextAnalysis analyze(String text) {
        String normalized = textNormalizer.normalizeBullet(requireText(text, "Text"));

        List<VerbMapper.WeakVerbMatch> weakVerbs = verbMapper.findWeakVerbs(normalized);
        List<String> impliedMetrics = metricDetector.detectImpliedMetrics(normalized);
        boolean hasMetric = metricDetector.hasMetric(normalized);

        List<String> suggestions = new ArrayList<>();
        for (VerbMapper.WeakVerbMatch match : weakVerbs) {
            verbMapper.suggestVerbUpgrade(match.verb(), normalized)
                    .ifPresent(upgrade -> suggestions.add("Replace \"" + match.matched() + "\" with \"" + upgrade + "\""));
        }
        suggestions.addAll(fluffDetector.getFluffRemovalSuggestions(normalized));
        if (!hasMetric && !impliedMetrics.isEmpty()) {
            suggestions.add("Add the number behind \"" + impliedMetrics.get(0) + "\" if you have it");
        } else if (!hasMetric) {
            suggestions.add("Quantify the result if you have a number for it");
        }

        return new TextAnalysis(
                planner.canImprove(normalized),
                weakVerbs.stream().map(VerbMapper.WeakVerbMatch::matched).toList(),
                fluffDetector.detectFluff(normalized).stream().map(FluffDetector.FluffMatch::phrase).toList(),
                metricDetector.detectMetrics(normalized).stream().map(MetricDetector.DetectedMetric::value).toList(),
                impliedMetrics,
                suggestions);
    }

    // ===== Internal methods =====

    private String requireText(String text, String label) {
        if (text == null || text.isBlank()) {
            throw new RewriteException(RewriteErrorCode.INVALID_INPUT, label + " is required");
        }
        int maxLength = properties.thresholds().maxInputLength();
        if (text.length() > maxLength) {
            throw new RewriteException(RewriteErrorCode.INVALID_INPUT,
                    String.format("%s must not exceed %d characters", label, maxLength));
        }
        return text;
    }

    private List<String> nonBlank(List<String> texts) {
        if (texts == null) {
            return List.of();
        }
        return texts.stream().filter(t -> t != null && !t.isBlank()).toList();
    }

    private EvidenceScope scopeOf(RewriteRequest request) {
        return request.evidenceScope() != null ? request.evidenceScope() : properties.defaults().evidenceScope();
    }

    private boolean enrichmentOf(RewriteRequest request) {
        return request.allowResumeEnrichment() != null
                ? request.allowResumeEnrichment()
                : properties.defaults().allowResumeEnrichment();
    }

    private EvidenceLedger buildLedger(Supplier<EvidenceLedger> builder) {
        try {
            return builder.get();
        } catch (RewriteException e) {
            throw e;
        } catch (Exception e) {
            log.error("Evidence ledger build failed", e);
            throw new RewriteException(RewriteErrorCode.EVIDENCE_BUILD_ERROR, "Evidence could not be built from the input", e);
        }
    }
}
