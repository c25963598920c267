package com.resumeai.infrastructure.ai.planning;

import com.resumeai.RewriteFixtures;
import com.resumeai.infrastructure.ai.lexicon.FluffCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class FluffDetectorTest {

    private FluffDetector fluffDetector;

    @BeforeEach
    void setUp() {
        fluffDetector = new FluffDetector(RewriteFixtures.LEXICON);
    }

    @Test
    @DisplayName("Fluff is detected by category, in text order")
    void detect() {
        assertThat(fluffDetector.detectFluff("Successfully delivered various features in order to improve UX"))
                .extracting(FluffDetector.FluffMatch::phrase, FluffDetector.FluffMatch::category)
                .containsExactly(
                        tuple("successfully", FluffCategory.UNNECESSARY_ADVERBS),
                        tuple("various", FluffCategory.WEAK_DESCRIPTORS),
                        tuple("in order to", FluffCategory.REDUNDANT_PHRASES));
    }

    @Test
    @DisplayName("Only whole words match")
    void whole_words_only() {
        assertThat(fluffDetector.hasFluff("Justified the budget")).isFalse();
        assertThat(fluffDetector.countFluff("Built a really fast cache")).isEqualTo(1);
    }

    @Test
    @DisplayName("Removal replaces redundant phrases and restores capitalization")
    void remove() {
        assertThat(fluffDetector.removeFluff("Successfully delivered features in order to improve onboarding"))
                .isEqualTo("Delivered features to improve onboarding");
    }

    @Test
    @DisplayName("Hype words are left in place")
    void hype_kept() {
        assertThat(fluffDetector.removeFluff("Built world-class tooling")).isEqualTo("Built world-class tooling");
    }

    @Test
    void suggestions() {
        assertThat(fluffDetector.getFluffRemovalSuggestions("Built cutting-edge tools in order to ship"))
                .containsExactly(
                        "Replace hype word \"cutting-edge\" with a concrete result",
                        "Replace \"in order to\" with \"to\"");
    }
}
