package com.resumeai.infrastructure.ai.evidence;

import com.resumeai.domain.rewrite.model.EvidenceLedger;
import com.resumeai.domain.rewrite.model.EvidenceMapItem;
import com.resumeai.domain.rewrite.model.ExtractedEntities;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EvidenceMapsTest {

    private final List<EvidenceMapItem> map = List.of(
            new EvidenceMapItem("Developed REST API", List.of("E1")),
            new EvidenceMapItem("using Python", List.of("E_skills", "E1")));

    @Test
    @DisplayName("Referenced ids are collected once, in order")
    void referenced_ids() {
        assertThat(EvidenceMaps.getAllReferencedEvidenceIds(map)).containsExactly("E1", "E_skills");
    }

    @Test
    @DisplayName("Span lookup is case-insensitive")
    void span_lookup() {
        assertThat(EvidenceMaps.isSpanMapped(map, "python")).isTrue();
        assertThat(EvidenceMaps.isSpanMapped(map, "Kafka")).isFalse();
        assertThat(EvidenceMaps.findEvidenceIdsForSpan(map, "REST API")).containsExactly("E1");
    }

    @Test
    @DisplayName("Unknown ids are reported against the ledger")
    void unknown_ids() {
        EvidenceLedger ledger = new EvidenceLedgerBuilder().buildEvidenceLedger("Built API", ExtractedEntities.empty());
        assertThat(EvidenceMaps.findUnknownEvidenceIds(map, ledger)).containsExactly("E_skills");
    }

    @Test
    @DisplayName("Merging unions ids of identical spans")
    void merge() {
        List<EvidenceMapItem> merged = EvidenceMaps.mergeEvidenceMaps(map,
                List.of(new EvidenceMapItem("Developed REST API", List.of("E2"))));

        assertThat(merged).hasSize(2);
        assertThat(merged.get(0).evidenceIds()).containsExactly("E1", "E2");
    }

    @Test
    @DisplayName("Coverage is the share of improved words inside mapped spans")
    void coverage() {
        double coverage = EvidenceMaps.calculateEvidenceCoverage("Developed REST API using Python daily", map);
        assertThat(coverage).isCloseTo(5.0 / 6.0, within(0.001));
        assertThat(EvidenceMaps.calculateEvidenceCoverage("Anything", List.of())).isZero();
    }

    @Test
    @DisplayName("Formatted map lists one span per line")
    void format() {
        assertThat(EvidenceMaps.formatEvidenceMap(map))
                .isEqualTo("\"Developed REST API\" <- E1\n\"using Python\" <- E_skills, E1");
        assertThat(EvidenceMaps.formatEvidenceMap(List.of())).isEqualTo("(no evidence map)");
    }
}
