package com.resumeai.infrastructure.ai.planning;

import com.resumeai.infrastructure.ai.lexicon.RewriteLexicon;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-driven metric detection and numeric token extraction.
 */
@Component
public class MetricDetector {

    // Most specific shape first; later patterns skip anything already matched
    private static final List<Pattern> NUMBER_PATTERNS = List.of(
            Pattern.compile("\\$\\s?\\d[\\d,]*(?:\\.\\d{1,2})?\\s?[KMBkmb]?\\b\\+?"),
            Pattern.compile("\\d+(?:\\.\\d+)?\\s?%"),
            Pattern.compile("\\b\\d+(?:\\.\\d+)?[KMBkmb]\\b\\+?"),
            Pattern.compile("\\b\\d+(?:\\.\\d+)?x\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?\\+?|\\b\\d+(?:\\.\\d+)?\\+?")
    );

    private static final Pattern NUMBER_CORE = Pattern.compile("\\d+(?:\\.\\d+)?");

    private final RewriteLexicon lexicon;
    private final List<Map.Entry<String, Pattern>> impliedPatterns;
    private final List<Map.Entry<String, Pattern>> scalePatterns;

    public MetricDetector(RewriteLexicon lexicon) {
        this.lexicon = lexicon;
        this.impliedPatterns = phrasePatterns(lexicon.impliedMetrics());
        this.scalePatterns = phrasePatterns(lexicon.scaleClaims());
    }

    /**
     * Every numeric token in the text, most specific form first, in order of appearance.
     */
    public List<String> extractNumbers(String text) {
        List<int[]> ranges = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        boolean[] covered = new boolean[text.length()];
        for (Pattern pattern : NUMBER_PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                if (overlaps(covered, m.start(), m.end())) {
                    continue;
                }
                Arrays.fill(covered, m.start(), m.end(), true);
                ranges.add(new int[]{m.start(), m.end()});
            }
        }
        ranges.sort(Comparator.comparingInt(r -> r[0]));
        return ranges.stream().map(r -> text.substring(r[0], r[1]).trim()).toList();
    }

    public Set<Double> extractAllNumberValues(Collection<String> texts) {
        Set<Double> values = new HashSet<>();
        for (String text : texts) {
            for (String number : extractNumbers(text)) {
                double value = normalizeNumber(number);
                if (!Double.isNaN(value)) {
                    values.add(value);
                }
            }
        }
        return values;
    }

    /**
     * Numeric value of a token; currency, separators, %, x and + are ignored, K/M/B scale it.
     *
     * @return the value, or NaN when the token holds no number
     */
    public static double normalizeNumber(String token) {
        if (token == null) {
            return Double.NaN;
        }
        String cleaned = token.replace(",", "").replace("$", "").trim();
        Matcher m = NUMBER_CORE.matcher(cleaned);
        if (!m.find()) {
            return Double.NaN;
        }
        double value = Double.parseDouble(m.group());
        String suffix = cleaned.substring(m.end()).trim().toUpperCase(Locale.ROOT);
        if (suffix.startsWith("K")) {
            value *= 1_000;
        } else if (suffix.startsWith("M")) {
            value *= 1_000_000;
        } else if (suffix.startsWith("B")) {
            value *= 1_000_000_000;
        }
        return value;
    }

    /**
     * Numbers in the improved text whose value appears neither in the original nor in any evidence text.
     */
    public List<String> findNewNumbers(String improved, String original, Collection<String> evidenceTexts) {
        List<String> sources = new ArrayList<>(evidenceTexts);
        sources.add(original);
        Set<Double> known = extractAllNumberValues(sources);
        return extractNumbers(improved).stream()
                .filter(number -> !known.contains(normalizeNumber(number)))
                .distinct()
                .toList();
    }

    public List<DetectedMetric> detectMetrics(String text) {
        List<DetectedMetric> metrics = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return metrics;
        }
        boolean[] covered = new boolean[text.length()];
        lexicon.metricPatterns().forEach((type, pattern) -> {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                if (!overlaps(covered, m.start(), m.end())) {
                    Arrays.fill(covered, m.start(), m.end(), true);
                    metrics.add(new DetectedMetric(type, m.group().trim(), m.start(), m.end()));
                }
            }
        });
        metrics.sort(Comparator.comparingInt(DetectedMetric::start));
        return metrics;
    }

    public boolean hasMetric(String text) {
        return !detectMetrics(text).isEmpty();
    }

    public List<String> detectImpliedMetrics(String text) {
        return findPhrases(impliedPatterns, text);
    }

    public boolean hasImpliedMetric(String text) {
        return !detectImpliedMetrics(text).isEmpty();
    }

    public boolean hasQuantifiableContent(String text) {
        return hasMetric(text) || hasImpliedMetric(text);
    }

    public List<String> detectScaleClaims(String text) {
        return findPhrases(scalePatterns, text);
    }

    public List<String> findNewScaleClaims(String improved, String original, Collection<String> evidenceTexts) {
        List<String> sources = new ArrayList<>(evidenceTexts);
        sources.add(original);
        Set<String> known = new HashSet<>();
        sources.forEach(source -> known.addAll(detectScaleClaims(source)));
        return detectScaleClaims(improved).stream()
                .filter(claim -> !known.contains(claim))
                .toList();
    }

    private List<String> findPhrases(List<Map.Entry<String, Pattern>> patterns, String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return patterns.stream()
                .filter(entry -> entry.getValue().matcher(text).find())
                .map(Map.Entry::getKey)
                .toList();
    }

    private static List<Map.Entry<String, Pattern>> phrasePatterns(List<String> phrases) {
        return phrases.stream()
                .map(phrase -> Map.entry(phrase,
                        Pattern.compile("(?<![\\w-])" + Pattern.quote(phrase) + "(?![\\w-])", Pattern.CASE_INSENSITIVE)))
                .toList();
    }

    private static boolean overlaps(boolean[] covered, int start, int end) {
        for (int i = start; i < end; i++) {
            if (covered[i]) {
                return true;
            }
        }
        return false;
    }

    public record DetectedMetric(String type, String value, int start, int end) {}
}
