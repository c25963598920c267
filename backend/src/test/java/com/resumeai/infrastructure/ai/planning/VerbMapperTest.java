package com.resumeai.infrastructure.ai.planning;

import com.resumeai.RewriteFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class VerbMapperTest {

    private VerbMapper verbMapper;

    @BeforeEach
    void setUp() {
        verbMapper = new VerbMapper(RewriteFixtures.LEXICON);
    }

    @Test
    @DisplayName("Longest weak phrase wins over its prefix")
    void longest_phrase_wins() {
        List<VerbMapper.WeakVerbMatch> matches = verbMapper.findWeakVerbs("Helped with backend development");

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).verb()).isEqualTo("helped with");
        assertThat(matches.get(0).matched()).isEqualTo("Helped with");
        assertThat(matches.get(0).start()).isZero();
    }

    @Test
    @DisplayName("Matches are ordered by position")
    void matches_in_order() {
        List<VerbMapper.WeakVerbMatch> matches = verbMapper.findWeakVerbs("Worked on the API and helped the team");

        assertThat(matches).extracting(VerbMapper.WeakVerbMatch::verb).containsExactly("worked on", "helped");
    }

    @Test
    @DisplayName("Context hints rank upgrades")
    void context_hint_first() {
        assertThat(verbMapper.suggestVerbUpgrade("worked on", "Worked on payments API")).contains("Built");
        assertThat(verbMapper.suggestVerbUpgrade("helped with", "Helped with backend development")).contains("Contributed to");
    }

    @Test
    @DisplayName("Ledger terms rank after bullet hints, before the default order")
    void ledger_terms_rank() {
        List<String> upgrades = verbMapper.suggestVerbUpgrades("helped", "Helped ship the release", Set.of("customers"));

        assertThat(upgrades).containsExactly("Supported", "Contributed", "Collaborated", "Enabled");
    }

    @Test
    @DisplayName("Unknown verbs have no upgrade")
    void unknown_verb() {
        assertThat(verbMapper.suggestVerbUpgrades("architected", "Architected the platform", Set.of())).isEmpty();
        assertThat(verbMapper.suggestVerbUpgrade("architected", "Architected the platform")).isEmpty();
    }

    @Test
    void weak_and_strong_openings() {
        assertThat(verbMapper.startsWithWeakVerb("Responsible for the billing service")).isTrue();
        assertThat(verbMapper.startsWithWeakVerb("Built billing service")).isFalse();
        assertThat(verbMapper.startsWithStrongVerb("Built billing service")).isTrue();
        assertThat(verbMapper.startsWithStrongVerb("Helped the team")).isFalse();
    }

    @Test
    void first_verb_skips_bullet_markers() {
        assertThat(verbMapper.extractFirstVerb("- Built API")).contains("Built");
        assertThat(verbMapper.extractFirstVerb("42")).isEmpty();
    }

    @Test
    void passive_voice() {
        assertThat(verbMapper.hasPassiveVoice("The API was designed by me")).isTrue();
        assertThat(verbMapper.hasPassiveVoice("Designed the API")).isFalse();
    }
}
