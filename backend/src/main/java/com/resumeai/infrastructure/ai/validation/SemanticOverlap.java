package com.resumeai.infrastructure.ai.validation;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lexical overlap measures between two texts, used as meaning-shift diagnostics.
 */
public final class SemanticOverlap {

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "from", "was", "were", "are", "been",
            "has", "have", "had", "not", "but", "our", "their", "its", "into", "over", "than",
            "them", "which", "also", "such", "more", "other", "some", "about", "using", "via",
            "across", "while", "through", "within", "per"
    );

    private SemanticOverlap() {
    }

    /**
     * Lower-case words longer than two characters, stop words removed.
     */
    public static Set<String> getSignificantWords(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null) {
            return words;
        }
        String cleaned = text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s-]", " ");
        for (String word : cleaned.split("\\s+")) {
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    public static double jaccardSimilarity(String a, String b) {
        Set<String> wordsA = stemAll(getSignificantWords(a));
        Set<String> wordsB = stemAll(getSignificantWords(b));
        if (wordsA.isEmpty() && wordsB.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(wordsA);
        intersection.retainAll(wordsB);
        Set<String> union = new HashSet<>(wordsA);
        union.addAll(wordsB);
        return (double) intersection.size() / union.size();
    }

    /**
     * |A intersect B| / min(|A|, |B|); 0 when either side has no significant words.
     */
    public static double overlapCoefficient(String a, String b) {
        Set<String> wordsA = stemAll(getSignificantWords(a));
        Set<String> wordsB = stemAll(getSignificantWords(b));
        if (wordsA.isEmpty() || wordsB.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(wordsA);
        intersection.retainAll(wordsB);
        return (double) intersection.size() / Math.min(wordsA.size(), wordsB.size());
    }

    /**
     * Share of the span's significant words that also occur in the evidence text.
     */
    public static double calculateOverlapRatio(String span, String evidenceText) {
        Set<String> spanWords = stemAll(getSignificantWords(span));
        if (spanWords.isEmpty()) {
            return 1.0;
        }
        Set<String> evidenceWords = stemAll(getSignificantWords(evidenceText));
        long shared = spanWords.stream().filter(evidenceWords::contains).count();
        return (double) shared / spanWords.size();
    }

    public static boolean verifySemanticOverlap(String span, String evidenceText, double threshold) {
        return calculateOverlapRatio(span, evidenceText) >= threshold;
    }

    public static boolean isSubstringMatch(String span, String evidenceText) {
        if (span == null || evidenceText == null || span.isBlank()) {
            return false;
        }
        String spanLower = span.toLowerCase(Locale.ROOT).trim();
        String evidenceLower = evidenceText.toLowerCase(Locale.ROOT);
        return evidenceLower.contains(spanLower) || spanLower.contains(evidenceLower.trim());
    }

    /**
     * Crude suffix stripping so "reduced" and "reduction" style pairs can meet.
     */
    public static String stem(String word) {
        String w = word.toLowerCase(Locale.ROOT);
        if (w.length() > 5 && w.endsWith("ing")) {
            return w.substring(0, w.length() - 3);
        }
        if (w.length() > 4 && w.endsWith("ed")) {
            return w.substring(0, w.length() - 2);
        }
        if (w.length() > 6 && w.endsWith("tion")) {
            return w.substring(0, w.length() - 4);
        }
        if (w.length() > 4 && w.endsWith("es")) {
            return w.substring(0, w.length() - 2);
        }
        if (w.length() > 3 && w.endsWith("s") && !w.endsWith("ss")) {
            return w.substring(0, w.length() - 1);
        }
        return w;
    }

    private static Set<String> stemAll(Set<String> words) {
        Set<String> stems = new LinkedHashSet<>();
        words.forEach(w -> stems.add(stem(w)));
        return stems;
    }
}
