package com.resumeai.infrastructure.ai.planning;

import com.resumeai.RewriteFixtures;
import com.resumeai.domain.rewrite.model.*;
import com.resumeai.infrastructure.ai.evidence.EvidenceLedgerBuilder;
import com.resumeai.infrastructure.ai.validation.ClaimExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MicroActionPlannerTest {

    private static final String WEAK_BULLET = "Helped with backend development";

    private EvidenceLedgerBuilder ledgerBuilder;
    private MicroActionPlanner planner;

    @BeforeEach
    void setUp() {
        ledgerBuilder = new EvidenceLedgerBuilder();
        planner = new MicroActionPlanner(
                new VerbMapper(RewriteFixtures.LEXICON),
                new FluffDetector(RewriteFixtures.LEXICON),
                new MetricDetector(RewriteFixtures.LEXICON),
                new ClaimExtractor(RewriteFixtures.LEXICON),
                ledgerBuilder,
                RewriteFixtures.LEXICON,
                RewriteFixtures.properties());
    }

    private EvidenceLedger skillsLedger(String bullet) {
        return ledgerBuilder.buildEvidenceLedger(bullet, ExtractedEntities.ofSkills(List.of("Python", "Node.js")));
    }

    @Nested
    @DisplayName("Bullet plans")
    class BulletPlans {

        @Test
        @DisplayName("Weak opening is upgraded using the bullet's own context")
        void verb_upgrade() {
            RewritePlan plan = planner.plan(WEAK_BULLET, skillsLedger(WEAK_BULLET), List.of("weak_verb"));

            assertThat(plan.goal()).isEqualTo(RewriteGoal.IMPACT);
            MicroAction upgrade = plan.actionsOf(MicroActionType.VERB_UPGRADE).get(0);
            assertThat(upgrade.get("from")).isEqualTo("Helped with");
            assertThat(upgrade.get("to")).isEqualTo("Contributed to");
        }

        @Test
        @DisplayName("No tool surfacing without a bullet context")
        void no_tool_surfacing_without_context() {
            RewritePlan plan = planner.plan(WEAK_BULLET, skillsLedger(WEAK_BULLET), List.of());

            assertThat(plan.hasAction(MicroActionType.TOOL_SURFACING)).isFalse();
            assertThat(plan.needsUserInput()).isEmpty();
        }

        @Test
        @DisplayName("Experience bullets ask before surfacing an unmentioned tool")
        void experience_context_asks() {
            RewritePlan plan = planner.plan(WEAK_BULLET, skillsLedger(WEAK_BULLET), List.of(),
                    BulletContext.of(SectionType.EXPERIENCE), null, List.of(WEAK_BULLET));

            assertThat(plan.hasAction(MicroActionType.TOOL_SURFACING)).isFalse();
            assertThat(plan.needsUserInput())
                    .extracting(UserInputRequest::prompt)
                    .containsExactly("Did you use Python in this role?", "Did you use Node.js in this role?");
        }

        @Test
        @DisplayName("Project bullets may surface relevant tools, each citing the ledger")
        void projects_surface_tools() {
            RewritePlan plan = planner.plan(WEAK_BULLET, skillsLedger(WEAK_BULLET), List.of(),
                    BulletContext.of(SectionType.PROJECTS), null, List.of());

            assertThat(plan.actionsOf(MicroActionType.TOOL_SURFACING))
                    .extracting(action -> action.get("tool"))
                    .containsExactly("Python", "Node.js");
            assertThat(plan.actionsOf(MicroActionType.TOOL_SURFACING))
                    .allSatisfy(action -> assertThat(action.evidenceIds()).containsExactly("E_skills"));
        }

        @Test
        @DisplayName("A sibling metric about the same work is surfaced")
        void metric_surfacing_from_sibling() {
            String bullet = "Optimized checkout queries";
            EvidenceLedger ledger = ledgerBuilder.buildEvidenceLedger(bullet,
                    List.of(bullet, "Optimized checkout page load by 40%"), EvidenceScope.SECTION, true,
                    ExtractedEntities.empty());

            RewritePlan plan = planner.plan(bullet, ledger, List.of("no_metric"));

            MicroAction surfacing = plan.actionsOf(MicroActionType.METRIC_SURFACING).get(0);
            assertThat(surfacing.get("metric")).isEqualTo("40%");
            assertThat(surfacing.evidenceIds()).containsExactly("E2");
        }

        @Test
        @DisplayName("Missing metric becomes a question, never a number")
        void missing_metric_question() {
            String bullet = "Built internal dashboard";
            RewritePlan plan = planner.plan(bullet, ledgerBuilder.buildEvidenceLedger(bullet, null), List.of("no_metric"));

            assertThat(plan.hasAction(MicroActionType.SPECIFICITY_INCREASE)).isTrue();
            assertThat(plan.hasAction(MicroActionType.METRIC_SURFACING)).isFalse();
            assertThat(plan.needsUserInput())
                    .extracting(UserInputRequest::prompt)
                    .containsExactly("What measurable result did this work produce?");
        }

        @Test
        void implied_metric_question() {
            String bullet = "Reduced page load time";
            RewritePlan plan = planner.plan(bullet, ledgerBuilder.buildEvidenceLedger(bullet, null), List.of());

            assertThat(plan.needsUserInput().get(0).prompt())
                    .isEqualTo("You wrote \"reduced\". Can you put a number on it?");
        }

        @Test
        void fluff_only_is_conciseness() {
            String bullet = "Built the billing service in order to support invoicing";
            RewritePlan plan = planner.plan(bullet, ledgerBuilder.buildEvidenceLedger(bullet, null), List.of());

            assertThat(plan.actionTypes()).containsExactly(MicroActionType.FLUFF_REMOVAL);
            assertThat(plan.goal()).isEqualTo(RewriteGoal.CONCISENESS);
        }

        @Test
        void role_tailoring() {
            RewritePlan plan = planner.plan(WEAK_BULLET, skillsLedger(WEAK_BULLET), List.of(),
                    null, "Staff Engineer", List.of());

            MicroAction tailoring = plan.actionsOf(MicroActionType.ROLE_TAILORING).get(0);
            assertThat(tailoring.get("role")).isEqualTo("Staff Engineer");
            assertThat(tailoring.evidenceIds()).isEmpty();
        }
    }

    @Test
    @DisplayName("Constraints allow grounded tools and forbid every other known one")
    void constraints() {
        RewritePlan plan = planner.plan(WEAK_BULLET, skillsLedger(WEAK_BULLET), List.of());
        RewriteConstraints constraints = plan.constraints();

        assertThat(constraints.allowedTools()).contains("python", "node.js");
        assertThat(constraints.forbiddenTools()).contains("kafka").doesNotContain("python");
        assertThat(constraints.forbidsTool("Kafka")).isTrue();
        assertThat(constraints.maxLength()).isEqualTo(RewriteFixtures.properties().thresholds().maxBulletLength());
    }

    @Test
    void summary_plan_can_surface_tools() {
        String summary = "Backend engineer building API services";
        RewritePlan plan = planner.planSummary(summary, skillsLedger(summary), null);

        assertThat(plan.hasAction(MicroActionType.TOOL_SURFACING)).isTrue();
        assertThat(plan.constraints().maxLength()).isEqualTo(RewriteFixtures.properties().thresholds().maxSummaryLength());
    }

    @Nested
    @DisplayName("canImprove")
    class CanImprove {

        @Test
        void strong_quantified_bullet_is_done() {
            assertThat(planner.canImprove("Reduced infrastructure costs by 40% using Terraform")).isFalse();
        }

        @Test
        void weak_opening_can_improve() {
            assertThat(planner.canImprove("Helped reduce infrastructure costs by 40% using Terraform")).isTrue();
        }

        @Test
        void short_or_fluffy_can_improve() {
            assertThat(planner.canImprove("Built API")).isTrue();
            assertThat(planner.canImprove("Successfully reduced infrastructure costs by 40% using Terraform")).isTrue();
        }

        @Test
        void blank_cannot_improve() {
            assertThat(planner.canImprove("   ")).isFalse();
            assertThat(planner.canImprove(null)).isFalse();
        }
    }
}
