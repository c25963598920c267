package com.resumeai.infrastructure.ai.coherence;

import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Deterministic formatting for finished bullets. Every operation is idempotent.
 */
@Component
public class FormatUnifier {

    private static final Pattern LEADING_GLYPHS = Pattern.compile("^\\s*(?:[-*\u2013\u2014]\\s+|[\u2022\u00B7\u25AA\u25E6\u2023]\\s*)+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.;,:!]+$");
    private static final Pattern PERCENT_WORD = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:percent|per cent|pct)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPACED_PERCENT = Pattern.compile("(\\d)\\s+%");

    // Only known code points are replaced
    private static final Map<String, String> ATS_REPLACEMENTS = new LinkedHashMap<>();

    static {
        ATS_REPLACEMENTS.put("\u2018", "'");
        ATS_REPLACEMENTS.put("\u2019", "'");
        ATS_REPLACEMENTS.put("\u201C", "\"");
        ATS_REPLACEMENTS.put("\u201D", "\"");
        ATS_REPLACEMENTS.put("\u2013", "-");
        ATS_REPLACEMENTS.put("\u2014", "-");
        ATS_REPLACEMENTS.put("\u2026", "...");
        ATS_REPLACEMENTS.put("\u2022", "-");
        ATS_REPLACEMENTS.put("\u00B7", "-");
        ATS_REPLACEMENTS.put("\u00AE", "");
        ATS_REPLACEMENTS.put("\u2122", "");
        ATS_REPLACEMENTS.put("\u00A9", "");
        ATS_REPLACEMENTS.put("\u00A0", " ");
        ATS_REPLACEMENTS.put("\u2007", " ");
        ATS_REPLACEMENTS.put("\u202F", " ");
    }

    private static final Map<String, List<String>> ALTERNATIVE_STARTS = Map.of(
            "developed", List.of("built", "created", "engineered", "designed"),
            "built", List.of("developed", "created", "constructed", "implemented"),
            "managed", List.of("led", "directed", "oversaw", "coordinated"),
            "led", List.of("managed", "directed", "spearheaded", "headed"),
            "improved", List.of("enhanced", "optimized", "strengthened", "refined"),
            "created", List.of("designed", "built", "produced", "established"),
            "implemented", List.of("delivered", "deployed", "executed", "built")
    );

    public String stripBulletGlyph(String text) {
        return LEADING_GLYPHS.matcher(text).replaceFirst("");
    }

    public String normalizeWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public String capitalizeFirst(String text) {
        if (text.isEmpty() || !Character.isLowerCase(text.charAt(0))) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    public String removeTrailingPunctuation(String text) {
        return TRAILING_PUNCTUATION.matcher(text).replaceAll("");
    }

    /**
     * "5 percent" and "5 %" become "5%". Digit grouping is left as written.
     */
    public String standardizeNumbers(String text) {
        String result = PERCENT_WORD.matcher(text).replaceAll("$1%");
        return SPACED_PERCENT.matcher(result).replaceAll("$1%");
    }

    public String makeATSSafe(String text) {
        String result = text;
        for (Map.Entry<String, String> entry : ATS_REPLACEMENTS.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result;
    }

    public List<String> makeAllATSSafe(List<String> bullets) {
        return bullets.stream().map(this::makeATSSafe).toList();
    }

    /**
     * Same shape for every bullet: no glyph, single spaces, no trailing punctuation, capital first letter.
     * Characters and numbers are left as written.
     */
    public List<String> unifyFormatting(List<String> bullets) {
        return bullets.stream().map(this::unifyBullet).toList();
    }

    public String applyFullFormatting(String text) {
        return unifyBullet(prepare(text));
    }

    public List<String> applyFullFormattingToAll(List<String> bullets) {
        return unifyFormatting(bullets.stream().map(this::prepare).toList());
    }

    // ATS-safe characters and standard numbers; a glyph turned into "-" is stripped again
    private String prepare(String text) {
        if (text == null) {
            return "";
        }
        return standardizeNumbers(stripBulletGlyph(makeATSSafe(stripBulletGlyph(text))));
    }

    private String unifyBullet(String text) {
        if (text == null) {
            return "";
        }
        String result = stripBulletGlyph(text);
        result = removeTrailingPunctuation(result);
        result = normalizeWhitespace(result);
        return capitalizeFirst(result);
    }

    public String getStartWord(String bullet) {
        String trimmed = bullet == null ? "" : bullet.trim();
        return trimmed.isEmpty() ? "" : WHITESPACE.split(trimmed, 2)[0];
    }

    /**
     * True when at least 70% of the bullets open with a distinct word.
     */
    public boolean hasVariedStarts(List<String> bullets) {
        if (bullets.isEmpty()) {
            return true;
        }
        long unique = bullets.stream()
                .map(b -> getStartWord(b).toLowerCase(Locale.ROOT))
                .distinct()
                .count();
        return unique >= bullets.size() * 0.7;
    }

    public Optional<String> getAlternativeStart(String currentStart, Set<String> usedStarts) {
        List<String> options = ALTERNATIVE_STARTS.getOrDefault(currentStart.toLowerCase(Locale.ROOT), List.of());
        return options.stream()
                .filter(option -> !usedStarts.contains(option))
                .findFirst()
                .map(this::capitalizeFirst);
    }
}
