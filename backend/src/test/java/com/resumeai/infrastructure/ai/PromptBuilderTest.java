package com.resumeai.infrastructure.ai;

import com.resumeai.domain.rewrite.model.*;
import com.resumeai.infrastructure.ai.evidence.EvidenceLedgerBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private PromptBuilder promptBuilder;
    private EvidenceLedger ledger;
    private RewritePlan plan;

    @BeforeEach
    void setUp() {
        promptBuilder = new PromptBuilder();
        ledger = new EvidenceLedgerBuilder().buildEvidenceLedger("Helped with backend development",
                List.of("Cut latency by 30%"), EvidenceScope.SECTION, true,
                ExtractedEntities.ofSkills(List.of("Python")));
        plan = new RewritePlan(RewriteGoal.IMPACT, List.of("weak_verb"),
                List.of(MicroAction.verbUpgrade("Helped with", List.of("Contributed to", "Supported")),
                        MicroAction.toolSurfacing("Python", "E_skills")),
                new RewriteConstraints(200, Set.of("30%"), Set.of("python"), Set.of(), Set.of("kafka")),
                List.of());
    }

    @Nested
    @DisplayName("Bullet prompt")
    class BulletPrompt {

        @Test
        void carries_plan_ledger_and_constraints() {
            RewritePrompt prompt = promptBuilder.buildBulletPrompt("Helped with backend development", ledger, plan, null);

            assertThat(prompt.system()).isEqualTo(PromptBuilder.SYSTEM_PROMPT_BULLET);
            assertThat(prompt.user())
                    .contains("ORIGINAL:\nHelped with backend development")
                    .contains("TARGET ROLE: General professional role")
                    .contains("- Replace the verb \"Helped with\" with \"Contributed to\" (or: Supported)")
                    .contains("- Mention the tool \"Python\" (evidence: E_skills)")
                    .contains("E1 (bullet): \"Helped with backend development\"")
                    .contains("E2 (section): \"Cut latency by 30%\"")
                    .contains("- Allowed numbers: 30%")
                    .contains("- Forbidden tools: kafka")
                    .contains("\"evidence_map\"");
        }

        @Test
        void section_bullets_use_section_system_prompt() {
            RewritePrompt prompt = promptBuilder.buildSectionBulletPrompt("Built API", ledger, plan, "Backend Engineer");

            assertThat(prompt.system()).isEqualTo(PromptBuilder.SYSTEM_PROMPT_SECTION);
            assertThat(prompt.user()).contains("TARGET ROLE: Backend Engineer");
        }

        @Test
        void empty_plan_tightens_only() {
            RewritePlan empty = new RewritePlan(RewriteGoal.CLARITY, List.of(), List.of(), plan.constraints(), List.of());

            assertThat(promptBuilder.buildBulletPrompt("Built API", ledger, empty, null).user())
                    .contains("No specific transformation planned");
        }
    }

    @Test
    void summary_prompt() {
        RewritePrompt prompt = promptBuilder.buildSummaryPrompt("Backend engineer", ledger, plan, "Staff Engineer");

        assertThat(prompt.system()).isEqualTo(PromptBuilder.SYSTEM_PROMPT_SUMMARY);
        assertThat(prompt.user())
                .contains("EVIDENCE AT A GLANCE:\nSkills: Python\nTools: None")
                .contains("TARGET ROLE: Staff Engineer");
    }

    @Test
    @DisplayName("Retry prompt lists the rejection reasons and keeps the system prompt")
    void retry_prompt() {
        List<ValidationItem> errors = List.of(
                ValidationItem.critical(ValidationCode.NEW_NUMBER_ADDED, "Number \"1M+\" appears in neither the original text nor the evidence"));

        RewritePrompt prompt = promptBuilder.buildRetryPrompt("Built API", ledger, errors, PromptBuilder.SYSTEM_PROMPT_BULLET);

        assertThat(prompt.system()).isEqualTo(PromptBuilder.SYSTEM_PROMPT_BULLET);
        assertThat(prompt.user())
                .contains("REJECTED")
                .contains("- NEW_NUMBER_ADDED: Number \"1M+\"");
    }

    @Test
    void strict_constraints_and_examples_are_appended() {
        RewritePrompt base = new RewritePrompt("system", "user");

        RewritePrompt strict = promptBuilder.addStrictConstraintsToPrompt(base);
        RewritePrompt examples = promptBuilder.addExamplesToPrompt(base);

        assertThat(strict.user()).startsWith("user").contains("STRICT CONSTRAINTS - VALIDATION WILL FAIL IF VIOLATED:");
        assertThat(examples.user())
                .contains("GOOD EXAMPLES:")
                .contains("BAD EXAMPLES (never do this):")
                .contains(PromptBuilder.BAD_EXAMPLES.get(0).rewrite());
        assertThat(examples.system()).isEqualTo("system");
    }

    @Test
    void compact_summary_and_token_estimate() {
        assertThat(promptBuilder.buildCompactEvidenceSummary(ledger))
                .isEqualTo("Skills: Python\nTools: None\nContext: Helped with backend development | Cut latency by 30%");
        assertThat(PromptBuilder.estimateTokenCount("abcdefgh")).isEqualTo(2);
        assertThat(PromptBuilder.estimateTokenCount(null)).isZero();
    }
}
