package com.resumeai.infrastructure.ai.coherence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FormatUnifierTest {

    private FormatUnifier formatUnifier;

    @BeforeEach
    void setUp() {
        formatUnifier = new FormatUnifier();
    }

    @Test
    @DisplayName("Full formatting strips glyphs, standardizes numbers and capitalizes")
    void full_formatting() {
        assertThat(formatUnifier.applyFullFormatting("\u2022 reduced costs by 40 percent.")).isEqualTo("Reduced costs by 40%");
        assertThat(formatUnifier.applyFullFormatting("- Cut   latency by 5 %;")).isEqualTo("Cut latency by 5%");
        assertThat(formatUnifier.applyFullFormatting(null)).isEmpty();
    }

    @Test
    @DisplayName("Formatting twice changes nothing")
    void idempotent() {
        List<String> inputs = List.of(
                "\u2022 reduced costs by 40 percent.",
                "\u2014 \u201CLed\u201D the migration\u2026",
                "Built API",
                "  - - nested glyphs ;");
        for (String input : inputs) {
            String once = formatUnifier.applyFullFormatting(input);
            assertThat(formatUnifier.applyFullFormatting(once)).isEqualTo(once);
        }
    }

    @Test
    @DisplayName("Section bullets share one shape")
    void unify_formatting() {
        List<String> bullets = List.of("\u2022 built the API.", "  Led   migration;", "- designed schema", "Cut costs by 5 percent");

        List<String> unified = formatUnifier.unifyFormatting(bullets);

        assertThat(unified).containsExactly("Built the API", "Led migration", "Designed schema", "Cut costs by 5 percent");
        assertThat(formatUnifier.unifyFormatting(unified)).isEqualTo(unified);
    }

    @Test
    @DisplayName("Full formatting of a list matches formatting each bullet")
    void full_formatting_all() {
        List<String> bullets = List.of("\u2022 reduced costs by 40 percent.", "\u2014 \u201CLed\u201D the migration\u2026");

        List<String> formatted = formatUnifier.applyFullFormattingToAll(bullets);

        assertThat(formatted).containsExactly("Reduced costs by 40%", "\"Led\" the migration");
        assertThat(formatUnifier.applyFullFormattingToAll(formatted)).isEqualTo(formatted);
    }

    @Test
    @DisplayName("ATS-safe replacement applied twice changes nothing")
    void ats_safe_idempotent() {
        List<String> inputs = List.of(
                "\u201CSmart\u201D quotes \u2014 and \u2018more\u2019\u2026 Acme\u2122",
                "5\u00A0engineers \u2022 \u00A9 2024",
                "Plain ASCII text");
        for (String input : inputs) {
            String once = formatUnifier.makeATSSafe(input);
            assertThat(formatUnifier.makeATSSafe(once)).isEqualTo(once);
        }
    }

    @Test
    @DisplayName("Typographic characters are replaced with ASCII")
    void ats_safe() {
        String safe = formatUnifier.makeATSSafe("\u201CSmart\u201D quotes \u2014 and \u2018more\u2019\u2026 Acme\u2122");

        assertThat(safe).isEqualTo("\"Smart\" quotes - and 'more'... Acme");
        assertThat(safe.chars()).allMatch(c -> c < 127);
        assertThat(formatUnifier.makeAllATSSafe(List.of("a\u2013b", "c d"))).containsExactly("a-b", "c d");
    }

    @Test
    void start_words() {
        assertThat(formatUnifier.getStartWord("  Built the API")).isEqualTo("Built");
        assertThat(formatUnifier.getStartWord(null)).isEmpty();
        assertThat(formatUnifier.hasVariedStarts(List.of("Built A", "Built B", "Led C"))).isFalse();
        assertThat(formatUnifier.hasVariedStarts(List.of("Built A", "Designed B", "Led C"))).isTrue();
    }

    @Test
    void alternative_start() {
        assertThat(formatUnifier.getAlternativeStart("Developed", Set.of("built"))).contains("Created");
        assertThat(formatUnifier.getAlternativeStart("Orchestrated", Set.of())).isEmpty();
    }
}
