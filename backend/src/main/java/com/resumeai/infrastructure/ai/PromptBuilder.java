package com.resumeai.infrastructure.ai;

import com.resumeai.domain.rewrite.model.*;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class PromptBuilder {

    // ===== System prompts =====

    static final String SYSTEM_PROMPT_BASE = """
            You are a resume editor. You rewrite resume content so it reads stronger and clearer
            while staying strictly truthful to the facts the candidate supplied.

            ## Hard rules
            1. Never add a number, percentage, amount or count that is not in the evidence.
            2. Never add a tool, technology or skill that is not in the evidence.
            3. Never add a company, organization or other proper noun that is not in the evidence.
            4. Never add scale language (massive, enterprise-wide, millions of) that the evidence does not support.
            5. Never add seniority (Senior, Lead, Principal) or personality traits the text does not state.
            6. Every changed phrase must cite the evidence ids that support it.

            ## Style
            - Open with a strong action verb.
            - Prefer concrete nouns over vague phrasing. Drop filler words.
            - Keep the original meaning.

            If the text cannot be improved without inventing facts, return it unchanged.""";

    static final String SYSTEM_PROMPT_BULLET = SYSTEM_PROMPT_BASE + """


            ## Task: single bullet
            Rewrite one resume bullet. Say what was done and how, and state impact only where evidence gives it.""";

    static final String SYSTEM_PROMPT_SUMMARY = SYSTEM_PROMPT_BASE + """


            ## Task: professional summary
            Rewrite a summary or headline. Lead with the candidate's strongest evidenced skills
            and aim it at the target role when one is given.""";

    static final String SYSTEM_PROMPT_SECTION = SYSTEM_PROMPT_BASE + """


            ## Task: bullet from a section
            This bullet belongs to a section of several bullets. Keep the tense consistent with the
            section and avoid repeating the opening verbs of the other bullets.""";

    private static final String RESPONSE_CONTRACT = """
            Reply with a single JSON object and nothing else:
            {
              "improved": "rewritten text",
              "evidence_map": [
                {"improved_span": "exact phrase copied from improved", "evidence_ids": ["E1"]}
              ],
              "reasoning": "one sentence on what changed",
              "changes": {
                "stronger_verb": false,
                "added_metric": false,
                "more_specific": false,
                "removed_fluff": false,
                "tailored_to_role": false
              }
            }""";

    private static final String STRICT_CONSTRAINTS = """

            STRICT CONSTRAINTS - VALIDATION WILL FAIL IF VIOLATED:
            - Do not add ANY number that is not in the evidence
            - Do not add ANY tool or technology that is not in the evidence
            - Do not add ANY company name that is not in the evidence
            - Do not add ANY scale claim (massive, large-scale, ...) without evidence
            - Every phrase of the output must be traceable to a listed evidence id
            The previous attempt was rejected. Be more conservative this time.""";

    static final List<Example> GOOD_EXAMPLES = List.of(
            new Example("Worked on API development",
                    "Python, Flask, 5 internal services",
                    "Developed Flask APIs in Python supporting 5 internal services",
                    "verb upgraded, tools and count taken from evidence"),
            new Example("Helped improve system performance",
                    "database indexing, query optimization",
                    "Improved system performance through database indexing and query optimization",
                    "specific method from evidence, no invented metric")
    );

    static final List<Example> BAD_EXAMPLES = List.of(
            new Example("Worked on API development",
                    "Python",
                    "Developed high-performance APIs processing 1M+ requests/day",
                    "1M+ requests/day is not in the evidence"),
            new Example("Led project",
                    "project management",
                    "Led cross-functional team of 15 engineers across 3 global offices",
                    "team size and office count are invented")
    );

    public RewritePrompt buildBulletPrompt(String original, EvidenceLedger ledger, RewritePlan plan, String targetRole) {
        return buildBulletPrompt(original, ledger, plan, targetRole, SYSTEM_PROMPT_BULLET);
    }

    public RewritePrompt buildSectionBulletPrompt(String original, EvidenceLedger ledger, RewritePlan plan, String targetRole) {
        return buildBulletPrompt(original, ledger, plan, targetRole, SYSTEM_PROMPT_SECTION);
    }

    public RewritePrompt buildSummaryPrompt(String summary, EvidenceLedger ledger, RewritePlan plan, String targetRole) {
        StringBuilder sb = new StringBuilder();
        sb.append("Rewrite this professional summary.\n\n");
        sb.append("ORIGINAL:\n").append(summary).append("\n\n");
        sb.append("TARGET ROLE: ").append(roleOrDefault(targetRole)).append("\n\n");
        if (!plan.transformations().isEmpty()) {
            sb.append("REWRITE PLAN:\n").append(formatTransformations(plan.transformations())).append("\n\n");
        }
        sb.append("EVIDENCE LEDGER (build the summary only from these):\n")
                .append(formatEvidenceLedger(ledger)).append("\n\n");
        sb.append("EVIDENCE AT A GLANCE:\n").append(buildCompactEvidenceSummary(ledger)).append("\n\n");
        sb.append("CONSTRAINTS:\n");
        sb.append("- Maximum length: ").append(plan.constraints().maxLength()).append(" characters\n");
        sb.append("- Only skills and tools from the evidence\n");
        sb.append("- Only claims the evidence supports\n\n");
        sb.append(RESPONSE_CONTRACT);
        return new RewritePrompt(SYSTEM_PROMPT_SUMMARY, sb.toString());
    }

    /**
     * Retry variant: lists the previous attempt's blocking errors, then restates original and ledger.
     */
    public RewritePrompt buildRetryPrompt(String original,
                                          EvidenceLedger ledger,
                                          List<ValidationItem> errors,
                                          String previousSystemPrompt) {
        StringBuilder sb = new StringBuilder();
        sb.append("Your previous rewrite was REJECTED by validation:\n\n");
        sb.append(formatValidationErrors(errors)).append("\n\n");
        sb.append("Rewrite again and stay closer to the evidence:\n");
        sb.append("- No number that is not in the evidence\n");
        sb.append("- No tool that is not in the evidence\n");
        sb.append("- Every mapped span must appear verbatim in the improved text and cite valid ids\n\n");
        sb.append("ORIGINAL:\n").append(original).append("\n\n");
        sb.append("EVIDENCE LEDGER:\n").append(formatEvidenceLedger(ledger)).append("\n\n");
        sb.append(RESPONSE_CONTRACT);
        return new RewritePrompt(previousSystemPrompt, sb.toString());
    }

    public RewritePrompt addStrictConstraintsToPrompt(RewritePrompt prompt) {
        return prompt.withUserSuffix("\n" + STRICT_CONSTRAINTS);
    }

    public RewritePrompt addExamplesToPrompt(RewritePrompt prompt) {
        StringBuilder sb = new StringBuilder("\n\nGOOD EXAMPLES:\n");
        for (int i = 0; i < GOOD_EXAMPLES.size(); i++) {
            Example ex = GOOD_EXAMPLES.get(i);
            sb.append(i + 1).append(". Original: \"").append(ex.original()).append("\"\n")
                    .append("   Evidence: ").append(ex.evidence()).append("\n")
                    .append("   Improved: \"").append(ex.rewrite()).append("\" (").append(ex.note()).append(")\n");
        }
        sb.append("\nBAD EXAMPLES (never do this):\n");
        for (int i = 0; i < BAD_EXAMPLES.size(); i++) {
            Example ex = BAD_EXAMPLES.get(i);
            sb.append(i + 1).append(". Original: \"").append(ex.original()).append("\"\n")
                    .append("   Evidence: ").append(ex.evidence()).append("\n")
                    .append("   Rejected: \"").append(ex.rewrite()).append("\" (").append(ex.note()).append(")\n");
        }
        return prompt.withUserSuffix(sb.toString().stripTrailing());
    }

    public String formatEvidenceLedger(EvidenceLedger ledger) {
        return ledger.items().stream()
                .map(item -> item.id() + " (" + item.type().value() + "): \"" + item.text() + "\"")
                .collect(Collectors.joining("\n"));
    }

    /**
     * One line per planned action.
     */
    public String formatTransformations(List<MicroAction> actions) {
        return actions.stream()
                .map(this::formatTransformation)
                .collect(Collectors.joining("\n"));
    }

    public String formatValidationErrors(List<ValidationItem> errors) {
        return errors.stream()
                .map(e -> "- " + e.code().name() + ": " + e.message())
                .collect(Collectors.joining("\n"));
    }

    /**
     * Skills, tools and the text context of a ledger on three lines.
     */
    public String buildCompactEvidenceSummary(EvidenceLedger ledger) {
        String skills = firstText(ledger, EvidenceType.SKILLS);
        String tools = firstText(ledger, EvidenceType.TOOLS);
        String context = ledger.items().stream()
                .filter(i -> i.type() == EvidenceType.BULLET || i.type() == EvidenceType.SECTION)
                .map(EvidenceItem::text)
                .collect(Collectors.joining(" | "));
        return "Skills: " + orNone(skills) + "\nTools: " + orNone(tools) + "\nContext: " + orNone(context);
    }

    public static int estimateTokenCount(String text) {
        return text == null ? 0 : (int) Math.ceil(text.length() / 4.0);
    }

    private RewritePrompt buildBulletPrompt(String original,
                                            EvidenceLedger ledger,
                                            RewritePlan plan,
                                            String targetRole,
                                            String systemPrompt) {
        RewriteConstraints constraints = plan.constraints();
        StringBuilder sb = new StringBuilder();
        sb.append("Rewrite this resume bullet.\n\n");
        sb.append("ORIGINAL:\n").append(original).append("\n\n");
        sb.append("TARGET ROLE: ").append(roleOrDefault(targetRole)).append("\n\n");
        sb.append("REWRITE PLAN (apply these transformations):\n");
        sb.append(plan.transformations().isEmpty()
                ? "- No specific transformation planned; tighten wording only"
                : formatTransformations(plan.transformations())).append("\n\n");
        sb.append("EVIDENCE LEDGER (use only facts from these):\n")
                .append(formatEvidenceLedger(ledger)).append("\n\n");
        sb.append("CONSTRAINTS:\n");
        sb.append("- Maximum length: ").append(constraints.maxLength()).append(" characters\n");
        sb.append("- Allowed numbers: ").append(joinOrNone(constraints.allowedNumbers()))
                .append(". Any other number is forbidden\n");
        sb.append("- Allowed tools: ").append(joinOrNone(constraints.allowedTools())).append("\n");
        if (!constraints.forbiddenTools().isEmpty()) {
            sb.append("- Forbidden tools: ").append(String.join(", ", constraints.forbiddenTools())).append("\n");
        }
        sb.append("- Allowed companies: ").append(joinOrNone(constraints.allowedCompanies()))
                .append(". Any other company name is forbidden\n\n");
        sb.append(RESPONSE_CONTRACT);
        return new RewritePrompt(systemPrompt, sb.toString());
    }

    private String formatTransformation(MicroAction action) {
        return switch (action.type()) {
            case VERB_UPGRADE -> "- Replace the verb \"" + action.get("from") + "\" with \"" + action.get("to") + "\""
                    + (action.get("alternatives").isEmpty() ? "" : " (or: " + action.get("alternatives") + ")");
            case FLUFF_REMOVAL -> "- Remove filler: " + action.get("terms");
            case METRIC_SURFACING -> "- Include the metric \"" + action.get("metric") + "\" (evidence: "
                    + String.join(", ", action.evidenceIds()) + ")";
            case TOOL_SURFACING -> "- Mention the tool \"" + action.get("tool") + "\" (evidence: "
                    + String.join(", ", action.evidenceIds()) + ")";
            case SPECIFICITY_INCREASE -> "- Be more specific: " + action.get("hint");
            case ROLE_TAILORING -> "- Tailor wording to the role \"" + action.get("role") + "\" without adding facts";
            case TENSE_ALIGN -> "- Use " + action.get("tense") + " tense";
        };
    }

    private String firstText(EvidenceLedger ledger, EvidenceType type) {
        return ledger.getEvidenceByType(type).stream().findFirst().map(EvidenceItem::text).orElse("");
    }

    private String roleOrDefault(String targetRole) {
        return targetRole == null || targetRole.isBlank() ? "General professional role" : targetRole;
    }

    private String joinOrNone(Set<String> values) {
        return values.isEmpty() ? "none" : String.join(", ", values);
    }

    private String orNone(String value) {
        return value.isBlank() ? "None" : value;
    }

    record Example(String original, String evidence, String rewrite, String note) {}
}
