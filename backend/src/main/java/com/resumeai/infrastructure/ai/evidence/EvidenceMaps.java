package com.resumeai.infrastructure.ai.evidence;

import com.resumeai.domain.rewrite.model.EvidenceLedger;
import com.resumeai.domain.rewrite.model.EvidenceMapItem;

import java.util.*;

/**
 * Read-only helpers over an evidence map.
 */
public final class EvidenceMaps {

    private EvidenceMaps() {
    }

    public static Set<String> getAllReferencedEvidenceIds(List<EvidenceMapItem> evidenceMap) {
        Set<String> ids = new LinkedHashSet<>();
        evidenceMap.forEach(item -> ids.addAll(item.evidenceIds()));
        return ids;
    }

    /**
     * True if some mapped span contains the given text (case-insensitive).
     */
    public static boolean isSpanMapped(List<EvidenceMapItem> evidenceMap, String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return evidenceMap.stream()
                .anyMatch(item -> !item.improvedSpan().isBlank()
                        && item.improvedSpan().toLowerCase(Locale.ROOT).contains(lower));
    }

    public static List<String> findEvidenceIdsForSpan(List<EvidenceMapItem> evidenceMap, String span) {
        Set<String> ids = new LinkedHashSet<>();
        String lower = span.toLowerCase(Locale.ROOT);
        for (EvidenceMapItem item : evidenceMap) {
            String mapped = item.improvedSpan().toLowerCase(Locale.ROOT);
            if (!mapped.isBlank() && (mapped.contains(lower) || lower.contains(mapped))) {
                ids.addAll(item.evidenceIds());
            }
        }
        return List.copyOf(ids);
    }

    public static List<String> findUnknownEvidenceIds(List<EvidenceMapItem> evidenceMap, EvidenceLedger ledger) {
        return getAllReferencedEvidenceIds(evidenceMap).stream()
                .filter(id -> !ledger.containsId(id))
                .toList();
    }

    /**
     * Merge maps; items with the same span get the union of their ids.
     */
    public static List<EvidenceMapItem> mergeEvidenceMaps(List<EvidenceMapItem> first, List<EvidenceMapItem> second) {
        Map<String, Set<String>> merged = new LinkedHashMap<>();
        for (List<EvidenceMapItem> map : List.of(first, second)) {
            for (EvidenceMapItem item : map) {
                merged.computeIfAbsent(item.improvedSpan(), k -> new LinkedHashSet<>()).addAll(item.evidenceIds());
            }
        }
        return merged.entrySet().stream()
                .map(e -> new EvidenceMapItem(e.getKey(), List.copyOf(e.getValue())))
                .toList();
    }

    /**
     * Share of the improved text's words that fall inside a mapped span.
     */
    public static double calculateEvidenceCoverage(String improved, List<EvidenceMapItem> evidenceMap) {
        String[] words = improved.trim().split("\\s+");
        if (improved.isBlank() || words.length == 0) {
            return 0.0;
        }
        Set<String> mappedWords = new HashSet<>();
        for (EvidenceMapItem item : evidenceMap) {
            for (String word : item.improvedSpan().toLowerCase(Locale.ROOT).split("\\s+")) {
                if (!word.isBlank()) {
                    mappedWords.add(word);
                }
            }
        }
        long covered = Arrays.stream(words)
                .filter(w -> mappedWords.contains(w.toLowerCase(Locale.ROOT)))
                .count();
        return (double) covered / words.length;
    }

    public static String formatEvidenceMap(List<EvidenceMapItem> evidenceMap) {
        if (evidenceMap.isEmpty()) {
            return "(no evidence map)";
        }
        StringBuilder sb = new StringBuilder();
        for (EvidenceMapItem item : evidenceMap) {
            sb.append("\"").append(item.improvedSpan()).append("\" <- ")
                    .append(String.join(", ", item.evidenceIds())).append("\n");
        }
        return sb.toString().trim();
    }
}
