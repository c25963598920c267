package com.resumeai.infrastructure.ai.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticOverlapTest {

    @Test
    void significant_words() {
        assertThat(SemanticOverlap.getSignificantWords("Built the API for billing"))
                .containsExactly("built", "api", "billing");
    }

    @Test
    @DisplayName("Identical or empty texts are fully similar")
    void jaccard_bounds() {
        assertThat(SemanticOverlap.jaccardSimilarity("Built billing API", "built billing api")).isEqualTo(1.0);
        assertThat(SemanticOverlap.jaccardSimilarity("", "")).isEqualTo(1.0);
        assertThat(SemanticOverlap.jaccardSimilarity("Built billing API", "Mentored new hires")).isZero();
    }

    @Test
    @DisplayName("Overlap coefficient ignores additions to the longer text")
    void overlap_coefficient() {
        assertThat(SemanticOverlap.overlapCoefficient("Built billing API", "Built billing API with Kafka")).isEqualTo(1.0);
        assertThat(SemanticOverlap.overlapCoefficient("", "Built billing API")).isZero();
    }

    @Test
    @DisplayName("Stemming lets inflections meet")
    void stemmed_overlap() {
        assertThat(SemanticOverlap.stem("reduced")).isEqualTo("reduc");
        assertThat(SemanticOverlap.stem("testing")).isEqualTo("test");
        assertThat(SemanticOverlap.stem("class")).isEqualTo("class");
        assertThat(SemanticOverlap.calculateOverlapRatio("Reduced costs", "Reducing costs sharply")).isEqualTo(1.0);
        assertThat(SemanticOverlap.verifySemanticOverlap("Migrated billing to Kafka", "Reduced costs", 0.3)).isFalse();
    }

    @Test
    void substring_match() {
        assertThat(SemanticOverlap.isSubstringMatch("billing API", "Built the billing API")).isTrue();
        assertThat(SemanticOverlap.isSubstringMatch(" ", "Built the billing API")).isFalse();
    }
}
