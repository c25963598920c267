package com.resumeai.infrastructure.ai.planning;

import com.resumeai.domain.rewrite.model.*;
import com.resumeai.infrastructure.ai.evidence.EvidenceLedgerBuilder;
import com.resumeai.infrastructure.ai.evidence.EvidenceLedgerBuilder.EnrichmentDecision;
import com.resumeai.infrastructure.ai.lexicon.RewriteLexicon;
import com.resumeai.infrastructure.ai.planning.MetricDetector.DetectedMetric;
import com.resumeai.infrastructure.ai.planning.VerbMapper.WeakVerbMatch;
import com.resumeai.infrastructure.ai.validation.ClaimExtractor;
import com.resumeai.infrastructure.ai.validation.SemanticOverlap;
import com.resumeai.infrastructure.config.RewriteProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Deterministic analysis of a bullet or summary into an ordered list of micro-actions
 * plus the hard constraints the rewrite must respect. No I/O.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MicroActionPlanner {

    private static final int MAX_SURFACED_TOOLS = 2;
    private static final int SPECIFIC_WORD_COUNT = 8;

    private final VerbMapper verbMapper;
    private final FluffDetector fluffDetector;
    private final MetricDetector metricDetector;
    private final ClaimExtractor claimExtractor;
    private final EvidenceLedgerBuilder ledgerBuilder;
    private final RewriteLexicon lexicon;
    private final RewriteProperties properties;

    public RewritePlan plan(String original, EvidenceLedger ledger, List<String> issues) {
        return plan(original, ledger, issues, null, null, List.of());
    }

    /**
     * Plan a bullet rewrite.
     *
     * @param original       the bullet text
     * @param ledger         evidence available to the rewrite
     * @param issues         issue tags reported upstream (weak_verb, no_metric, too_vague, ...)
     * @param context        where the bullet sits; tool surfacing is never planned without it
     * @param targetRole     optional role to tailor towards
     * @param sectionBullets sibling bullets of the same section
     */
    public RewritePlan plan(String original,
                            EvidenceLedger ledger,
                            List<String> issues,
                            BulletContext context,
                            String targetRole,
                            List<String> sectionBullets) {
        List<String> issueTags = normalizeIssues(issues);
        List<MicroAction> actions = new ArrayList<>();
        List<UserInputRequest> questions = new ArrayList<>();
        boolean hasMetric = metricDetector.hasMetric(original);

        planVerbUpgrade(original, ledger, issueTags, actions);
        planFluffRemoval(original, actions);

        if (verbMapper.hasPassiveVoice(original)) {
            actions.add(MicroAction.specificity("active_voice",
                    "Rewrite in active voice with the candidate as the actor"));
        }
        if (issueTags.contains("no_metric") && !hasMetric) {
            actions.add(MicroAction.specificity("how",
                    "Describe how the work was done (method, scope, tools already listed) instead of adding numbers"));
        }
        if (issueTags.contains("vague") || issueTags.contains("too_vague")) {
            actions.add(MicroAction.specificity("outcome",
                    "Name the concrete deliverable or outcome of the work"));
        }

        if (!hasMetric) {
            planToolSurfacing(original, ledger, context, sectionBullets, actions, questions);
            boolean surfaced = planMetricSurfacing(original, ledger, actions);
            planMetricQuestions(original, issueTags, surfaced, questions);
        }

        planRoleTailoring(ledger, targetRole, actions);

        RewritePlan plan = new RewritePlan(
                determineGoal(actions, issueTags),
                issueTags,
                actions,
                buildConstraints(original, ledger, properties.thresholds().maxBulletLength()),
                questions);
        log.info("Bullet plan - goal: {}, actions: {}, questions: {}",
                plan.goal(), plan.actionTypes(), questions.size());
        return plan;
    }

    /**
     * Plan a summary rewrite. Summaries may always surface resume-level tools.
     */
    public RewritePlan planSummary(String summary, EvidenceLedger ledger, String targetRole) {
        List<MicroAction> actions = new ArrayList<>();
        List<UserInputRequest> questions = new ArrayList<>();

        planVerbUpgrade(summary, ledger, List.of(), actions);
        planFluffRemoval(summary, actions);
        planToolSurfacing(summary, ledger, BulletContext.of(SectionType.SUMMARY), List.of(), actions, questions);
        planRoleTailoring(ledger, targetRole, actions);

        RewriteGoal goal = actions.isEmpty() ? RewriteGoal.CLARITY : determineGoal(actions, List.of());
        RewritePlan plan = new RewritePlan(goal, List.of(), actions,
                buildConstraints(summary, ledger, properties.thresholds().maxSummaryLength()),
                questions);
        log.info("Summary plan - goal: {}, actions: {}", plan.goal(), plan.actionTypes());
        return plan;
    }

    /**
     * Cheap gate: true when the text has a weak opening, fluff, or neither a metric nor specifics.
     */
    public boolean canImprove(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String stripped = text.strip();
        if (stripped.length() < properties.thresholds().minBulletLength()) {
            return true;
        }
        if (verbMapper.startsWithWeakVerb(stripped) || fluffDetector.hasFluff(stripped)) {
            return true;
        }
        boolean specific = !claimExtractor.extractTechTerms(stripped).isEmpty()
                || stripped.split("\\s+").length >= SPECIFIC_WORD_COUNT;
        return !metricDetector.hasMetric(stripped) && !specific;
    }

    /**
     * Everything the ledger or the original grounds is allowed; every other known tool is forbidden.
     */
    public RewriteConstraints buildConstraints(String original, EvidenceLedger ledger, int maxLength) {
        List<String> sources = new ArrayList<>(ledger.texts());
        sources.add(original);

        Set<String> numbers = new LinkedHashSet<>();
        Set<String> tools = new LinkedHashSet<>();
        Set<String> companies = new LinkedHashSet<>();
        for (String source : sources) {
            numbers.addAll(metricDetector.extractNumbers(source));
            tools.addAll(claimExtractor.extractTechTerms(source));
            companies.addAll(claimExtractor.extractCompanies(source));
        }
        for (EvidenceItem item : ledger.items()) {
            if (item.type() == EvidenceType.TOOLS || item.type() == EvidenceType.SKILLS) {
                tools.addAll(item.normalizedTerms());
            }
        }

        Set<String> forbidden = new TreeSet<>(lexicon.techTerms());
        forbidden.removeAll(tools);
        return new RewriteConstraints(maxLength, numbers, tools, companies, forbidden);
    }

    private void planVerbUpgrade(String original, EvidenceLedger ledger, List<String> issues, List<MicroAction> actions) {
        List<WeakVerbMatch> weakVerbs = verbMapper.findWeakVerbs(original);
        if (weakVerbs.isEmpty()) {
            return;
        }
        WeakVerbMatch first = weakVerbs.get(0);
        boolean leading = original.strip().toLowerCase(Locale.ROOT)
                .startsWith(first.matched().toLowerCase(Locale.ROOT));
        if (!leading && !issues.contains("weak_verb")) {
            return;
        }
        List<String> upgrades = verbMapper.suggestVerbUpgrades(first.verb(), original, ledger.getAllNormalizedTerms());
        if (!upgrades.isEmpty()) {
            actions.add(MicroAction.verbUpgrade(first.matched(), upgrades));
        }
    }

    private void planFluffRemoval(String original, List<MicroAction> actions) {
        List<String> terms = fluffDetector.detectFluff(original).stream()
                .map(FluffDetector.FluffMatch::phrase)
                .distinct()
                .toList();
        if (!terms.isEmpty()) {
            actions.add(MicroAction.fluffRemoval(terms));
        }
    }

    private void planToolSurfacing(String original,
                                   EvidenceLedger ledger,
                                   BulletContext context,
                                   List<String> sectionBullets,
                                   List<MicroAction> actions,
                                   List<UserInputRequest> questions) {
        if (!ledger.allowResumeEnrichment()) {
            return;
        }
        int considered = 0;
        for (EvidenceItem item : ledger.items()) {
            if (item.type() != EvidenceType.TOOLS && item.type() != EvidenceType.SKILLS) {
                continue;
            }
            for (String entry : item.text().split(",\\s*")) {
                if (considered >= MAX_SURFACED_TOOLS) {
                    return;
                }
                String tool = entry.trim();
                if (tool.isEmpty() || mentions(original, tool) || !isRelevantTool(tool, original)) {
                    continue;
                }
                considered++;
                EnrichmentDecision decision = ledgerBuilder.allowResumeEnrichmentInBullet(context, tool, sectionBullets);
                if (decision.allowed()) {
                    actions.add(MicroAction.toolSurfacing(tool, item.id()));
                } else if ("needs_user_confirmation".equals(decision.reason())) {
                    questions.add(new UserInputRequest(
                            "Did you use " + tool + " in this role?",
                            "Yes, I used " + tool + " to build ..."));
                } else {
                    log.debug("Tool surfacing skipped - tool: {}, reason: {}", tool, decision.reason());
                }
            }
        }
    }

    // A sibling bullet about the same work that already carries a number
    private boolean planMetricSurfacing(String original, EvidenceLedger ledger, List<MicroAction> actions) {
        Set<String> words = SemanticOverlap.getSignificantWords(original);
        for (EvidenceItem item : ledger.getEvidenceByType(EvidenceType.SECTION)) {
            if (item.text().equals(original)) {
                continue;
            }
            List<DetectedMetric> metrics = metricDetector.detectMetrics(item.text());
            if (metrics.isEmpty()) {
                continue;
            }
            Set<String> shared = new HashSet<>(SemanticOverlap.getSignificantWords(item.text()));
            shared.retainAll(words);
            if (!shared.isEmpty()) {
                actions.add(MicroAction.metricSurfacing(metrics.get(0).value(), List.of(item.id())));
                return true;
            }
        }
        return false;
    }

    private void planMetricQuestions(String original, List<String> issues, boolean surfaced, List<UserInputRequest> questions) {
        List<String> implied = metricDetector.detectImpliedMetrics(original);
        if (!implied.isEmpty()) {
            questions.add(new UserInputRequest(
                    "You wrote \"" + implied.get(0) + "\". Can you put a number on it?",
                    "e.g. 'about 30 customers' or '25% faster'"));
        } else if (!surfaced && issues.contains("no_metric")) {
            questions.add(new UserInputRequest(
                    "What measurable result did this work produce?",
                    "e.g. 'cut report time from 2 days to 4 hours'"));
        }
    }

    private void planRoleTailoring(EvidenceLedger ledger, String targetRole, List<MicroAction> actions) {
        if (targetRole == null || targetRole.isBlank()) {
            return;
        }
        List<String> ids = ledger.containsId(EvidenceLedgerBuilder.TITLES_EVIDENCE_ID)
                ? List.of(EvidenceLedgerBuilder.TITLES_EVIDENCE_ID)
                : List.of();
        actions.add(MicroAction.roleTailoring(targetRole.trim(), ids));
    }

    private RewriteGoal determineGoal(List<MicroAction> actions, List<String> issues) {
        boolean impact = issues.contains("no_metric") || actions.stream().anyMatch(a ->
                a.type() == MicroActionType.VERB_UPGRADE
                        || a.type() == MicroActionType.METRIC_SURFACING
                        || a.type() == MicroActionType.TOOL_SURFACING);
        if (impact) {
            return RewriteGoal.IMPACT;
        }
        boolean fluffOnly = !actions.isEmpty()
                && actions.stream().allMatch(a -> a.type() == MicroActionType.FLUFF_REMOVAL);
        if (fluffOnly || issues.contains("too_long")) {
            return RewriteGoal.CONCISENESS;
        }
        return RewriteGoal.CLARITY;
    }

    private boolean isRelevantTool(String tool, String original) {
        List<String> keywords = lexicon.toolRelevance().get(tool.toLowerCase(Locale.ROOT));
        if (keywords == null || keywords.isEmpty()) {
            return tool.length() >= 3;
        }
        String lower = original.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }

    private boolean mentions(String text, String tool) {
        return text.toLowerCase(Locale.ROOT).contains(tool.toLowerCase(Locale.ROOT))
                || claimExtractor.mentionsTerm(text, tool);
    }

    private List<String> normalizeIssues(List<String> issues) {
        if (issues == null) {
            return List.of();
        }
        return issues.stream()
                .filter(Objects::nonNull)
                .map(i -> i.trim().toLowerCase(Locale.ROOT))
                .filter(i -> !i.isEmpty())
                .distinct()
                .toList();
    }
}
