package com.resumeai.infrastructure.ai.pipeline;

import com.resumeai.RewriteFixtures;
import com.resumeai.domain.rewrite.model.*;
import com.resumeai.domain.rewrite.service.GenerationBackend;
import com.resumeai.infrastructure.ai.coherence.FormatUnifier;
import com.resumeai.infrastructure.ai.coherence.TenseUnifier;
import com.resumeai.infrastructure.ai.evidence.EvidenceLedgerBuilder;
import com.resumeai.infrastructure.ai.planning.FluffDetector;
import com.resumeai.infrastructure.ai.planning.MetricDetector;
import com.resumeai.infrastructure.ai.planning.MicroActionPlanner;
import com.resumeai.infrastructure.ai.planning.VerbMapper;
import com.resumeai.infrastructure.ai.validation.ClaimExtractor;
import com.resumeai.infrastructure.config.RewriteProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SectionRewritePipelineTest {

    @Mock
    private GenerationBackend generationBackend;

    @Mock
    private RewritePipeline rewritePipeline;

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

    private SectionRewritePipeline pipelineWith(RewriteProperties properties) {
        return new SectionRewritePipeline(planner, rewritePipeline, generationBackend,
                new TenseUnifier(RewriteFixtures.LEXICON), new FormatUnifier(), properties);
    }

    private SectionRewriteResult rewrite(SectionRewritePipeline pipeline, List<String> bullets) {
        EvidenceLedger ledger = ledgerBuilder.buildSectionEvidenceLedger(bullets, ExtractedEntities.empty(), null, true);
        return pipeline.rewriteSection(SectionRewriteRequest.of(bullets, null), ledger);
    }

    private static RewriteResult result(String original, String improved, ValidationResult validation,
                                        ConfidenceLevel confidence, int gain) {
        return new RewriteResult(RewriteType.BULLET, original, improved,
                List.of(new EvidenceMapItem(improved, List.of("E1"))), validation, "test", RewriteChanges.none(),
                confidence, validation.passed() ? RewriteStatus.PASSED : RewriteStatus.EXHAUSTED, 1, gain, List.of());
    }

    @Nested
    @DisplayName("Without a generation backend")
    class WithoutBackend {

        @BeforeEach
        void unavailable() {
            when(generationBackend.isAvailable()).thenReturn(false);
        }

        @Test
        @DisplayName("Coherence pass unifies tense and formatting of the unchanged bullets")
        void coherence_pass() {
            List<String> bullets = List.of("Developed API", "Builds dashboards", "Developed pipelines.");

            SectionRewriteResult result = rewrite(pipelineWith(RewriteFixtures.properties()), bullets);

            assertThat(result.dominantTense()).isEqualTo(Tense.PAST);
            assertThat(result.originalBullets()).isEqualTo(bullets);
            assertThat(result.improvedBullets()).containsExactly("Developed API", "Built dashboards", "Developed pipelines");
            assertThat(result.sectionNotes()).containsExactly(
                    "Bullet 3 starts with repeated word \"developed\" (consider \"Built\")",
                    "Many bullets open with the same word",
                    "Unified tense to past",
                    "Applied consistent formatting");
            assertThat(result.perBulletDetails())
                    .extracting(detail -> detail.bulletResult().status())
                    .containsOnly(RewriteStatus.SKIPPED);
            assertThat(result.confidence()).isEqualTo(ConfidenceLevel.LOW);
            assertThat(result.validationSummary().passed()).isTrue();
            assertThat(result.estimatedAggregateGain()).isZero();
            verifyNoInteractions(rewritePipeline);
        }

        @Test
        void coherence_pass_can_be_disabled() {
            List<String> bullets = List.of("Developed API", "Builds dashboards");

            SectionRewriteResult result = rewrite(pipelineWith(RewriteFixtures.withFeatures(true, false, true, true)), bullets);

            assertThat(result.improvedBullets()).isEqualTo(bullets);
            assertThat(result.sectionNotes()).isEmpty();
        }
    }

    @Nested
    @DisplayName("With a generation backend")
    class WithBackend {

        @BeforeEach
        void available() {
            when(generationBackend.isAvailable()).thenReturn(true);
        }

        @Test
        @DisplayName("Off-tense bullets get a tense action and findings carry the bullet number")
        void aggregates_bullet_results() {
            List<String> bullets = List.of("Developed API", "Builds dashboards");
            ValidationResult failed = ValidationResult.of(List.of(
                    ValidationItem.critical(ValidationCode.NEW_NUMBER_ADDED, "Number \"5\" is new")));
            when(rewritePipeline.rewriteBullet(eq("Developed API"), any(), any(), any(), eq(RewriteType.SECTION)))
                    .thenReturn(result("Developed API", "Built API", ValidationResult.clean(), ConfidenceLevel.HIGH, 2));
            when(rewritePipeline.rewriteBullet(eq("Builds dashboards"), any(), any(), any(), eq(RewriteType.SECTION)))
                    .thenReturn(result("Builds dashboards", "Built 5 dashboards", failed, ConfidenceLevel.LOW, 0));

            SectionRewriteResult result = rewrite(pipelineWith(RewriteFixtures.properties()), bullets);

            ArgumentCaptor<RewritePlan> plans = ArgumentCaptor.forClass(RewritePlan.class);
            verify(rewritePipeline, times(2)).rewriteBullet(anyString(), any(), plans.capture(), any(), eq(RewriteType.SECTION));
            assertThat(plans.getAllValues().get(0).hasAction(MicroActionType.TENSE_ALIGN)).isFalse();
            assertThat(plans.getAllValues().get(1).actionsOf(MicroActionType.TENSE_ALIGN))
                    .extracting(action -> action.get("tense"))
                    .containsExactly("past");

            assertThat(result.validationSummary().passed()).isFalse();
            assertThat(result.validationSummary().items())
                    .extracting(ValidationItem::message)
                    .containsExactly("Bullet 2: Number \"5\" is new");
            assertThat(result.confidence()).isEqualTo(ConfidenceLevel.LOW);
            assertThat(result.estimatedAggregateGain()).isEqualTo(2);
            assertThat(result.sectionNotes()).contains("Bullet 2 starts with repeated word \"built\" (consider \"Developed\")");
        }

        @Test
        void all_high_is_high() {
            List<String> bullets = List.of("Developed API", "Led migration");
            when(rewritePipeline.rewriteBullet(anyString(), any(), any(), any(), eq(RewriteType.SECTION)))
                    .thenAnswer(invocation -> {
                        String bullet = invocation.getArgument(0);
                        return result(bullet, bullet, ValidationResult.clean(), ConfidenceLevel.HIGH, 1);
                    });

            SectionRewriteResult result = rewrite(pipelineWith(RewriteFixtures.properties()), bullets);

            assertThat(result.confidence()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(result.estimatedAggregateGain()).isEqualTo(2);
            assertThat(result.sectionNotes()).isEmpty();
        }
    }
}
