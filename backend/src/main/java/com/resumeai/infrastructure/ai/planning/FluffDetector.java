package com.resumeai.infrastructure.ai.planning;

import com.resumeai.infrastructure.ai.lexicon.FluffCategory;
import com.resumeai.infrastructure.ai.lexicon.RewriteLexicon;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects filler, hype and redundant phrasing. The probes are read-only and usable without
 * running the planner.
 */
@Component
public class FluffDetector {

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("\\s{2,}");
    private static final Pattern SPACE_BEFORE_PUNCT = Pattern.compile("\\s+([,.;:])");
    private static final Pattern DANGLING_COMMA = Pattern.compile("(^\\s*,\\s*)|(,\\s*(?=[.;:]|$))");

    private final RewriteLexicon lexicon;
    private final List<PhrasePattern> patterns;

    public FluffDetector(RewriteLexicon lexicon) {
        this.lexicon = lexicon;
        List<PhrasePattern> all = new ArrayList<>();
        lexicon.fluffPhrases().forEach((category, phrases) -> phrases.forEach(phrase ->
                all.add(new PhrasePattern(phrase, category,
                        Pattern.compile("(?<![\\w-])" + Pattern.quote(phrase) + "(?![\\w-])", Pattern.CASE_INSENSITIVE)))));
        all.sort(Comparator.comparingInt((PhrasePattern p) -> p.phrase().length()).reversed());
        this.patterns = List.copyOf(all);
    }

    public List<FluffMatch> detectFluff(String text) {
        List<FluffMatch> matches = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return matches;
        }
        boolean[] covered = new boolean[text.length()];
        for (PhrasePattern pattern : patterns) {
            Matcher m = pattern.regex().matcher(text);
            while (m.find()) {
                boolean overlaps = false;
                for (int i = m.start(); i < m.end(); i++) {
                    if (covered[i]) {
                        overlaps = true;
                        break;
                    }
                }
                if (overlaps) {
                    continue;
                }
                Arrays.fill(covered, m.start(), m.end(), true);
                matches.add(new FluffMatch(pattern.phrase(), pattern.category(), m.start(), m.end()));
            }
        }
        matches.sort(Comparator.comparingInt(FluffMatch::start));
        return matches;
    }

    public boolean hasFluff(String text) {
        return !detectFluff(text).isEmpty();
    }

    public int countFluff(String text) {
        return detectFluff(text).size();
    }

    /**
     * Replace redundant phrases with their concise form and drop the other fluff.
     * Hype words and cliches are left for the generator since removing them can break grammar.
     */
    public String removeFluff(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }
        List<FluffMatch> matches = detectFluff(text);
        StringBuilder sb = new StringBuilder(text);
        for (int i = matches.size() - 1; i >= 0; i--) {
            FluffMatch match = matches.get(i);
            switch (match.category()) {
                case REDUNDANT_PHRASES -> sb.replace(match.start(), match.end(),
                        lexicon.fluffReplacements().getOrDefault(match.phrase(), match.phrase()));
                case FILLERS, VAGUE_PHRASES, WEAK_DESCRIPTORS, UNNECESSARY_ADVERBS ->
                        sb.delete(match.start(), match.end());
                case HYPE_WORDS, CLICHES -> {
                    // kept
                }
            }
        }
        String result = MULTIPLE_SPACES.matcher(sb.toString()).replaceAll(" ");
        result = SPACE_BEFORE_PUNCT.matcher(result).replaceAll("$1");
        result = DANGLING_COMMA.matcher(result).replaceAll("");
        result = result.strip();
        if (!result.isEmpty() && Character.isLowerCase(result.charAt(0)) && Character.isUpperCase(text.strip().charAt(0))) {
            result = Character.toUpperCase(result.charAt(0)) + result.substring(1);
        }
        return result;
    }

    public List<String> getFluffRemovalSuggestions(String text) {
        return detectFluff(text).stream()
                .map(match -> switch (match.category()) {
                    case REDUNDANT_PHRASES -> "Replace \"" + match.phrase() + "\" with \""
                            + lexicon.fluffReplacements().getOrDefault(match.phrase(), "") + "\"";
                    case HYPE_WORDS -> "Replace hype word \"" + match.phrase() + "\" with a concrete result";
                    case CLICHES -> "Replace cliche \"" + match.phrase() + "\" with evidence of the trait";
                    case VAGUE_PHRASES -> "Name the specifics instead of \"" + match.phrase() + "\"";
                    default -> "Remove \"" + match.phrase() + "\"";
                })
                .distinct()
                .toList();
    }

    public record FluffMatch(String phrase, FluffCategory category, int start, int end) {}

    private record PhrasePattern(String phrase, FluffCategory category, Pattern regex) {}
}
