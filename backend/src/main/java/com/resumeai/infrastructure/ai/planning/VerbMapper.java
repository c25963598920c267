package com.resumeai.infrastructure.ai.planning;

import com.resumeai.infrastructure.ai.lexicon.RewriteLexicon;
import com.resumeai.infrastructure.ai.lexicon.RewriteLexicon.VerbMapping;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Weak-verb detection and ranked strong-verb suggestions.
 */
@Component
public class VerbMapper {

    private static final Pattern FIRST_WORD = Pattern.compile("^[^A-Za-z]*([A-Za-z][A-Za-z'-]*)");

    private final RewriteLexicon lexicon;
    // Longest phrase first so "helped with" wins over "helped"
    private final List<Map.Entry<String, Pattern>> weakVerbPatterns;

    public VerbMapper(RewriteLexicon lexicon) {
        this.lexicon = lexicon;
        this.weakVerbPatterns = lexicon.weakVerbs().keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(verb -> Map.entry(verb, Pattern.compile("\\b" + Pattern.quote(verb) + "\\b", Pattern.CASE_INSENSITIVE)))
                .toList();
    }

    public List<WeakVerbMatch> findWeakVerbs(String text) {
        List<WeakVerbMatch> matches = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return matches;
        }
        boolean[] covered = new boolean[text.length()];
        for (Map.Entry<String, Pattern> entry : weakVerbPatterns) {
            Matcher m = entry.getValue().matcher(text);
            while (m.find()) {
                if (isCovered(covered, m.start(), m.end())) {
                    continue;
                }
                Arrays.fill(covered, m.start(), m.end(), true);
                matches.add(new WeakVerbMatch(entry.getKey(), m.group(), m.start(), m.end()));
            }
        }
        matches.sort(Comparator.comparingInt(WeakVerbMatch::start));
        return matches;
    }

    public boolean startsWithWeakVerb(String text) {
        if (text == null) {
            return false;
        }
        String stripped = text.strip();
        String lower = stripped.toLowerCase(Locale.ROOT);
        return lexicon.weakStartPhrases().stream().anyMatch(lower::startsWith)
                || findWeakVerbs(stripped).stream().anyMatch(m -> m.start() == 0);
    }

    /**
     * Best single upgrade for the verb given the bullet text.
     */
    public Optional<String> suggestVerbUpgrade(String verb, String context) {
        List<String> ranked = suggestVerbUpgrades(verb, context, Set.of());
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    /**
     * Upgrades ranked by contextual fit: hints whose keyword occurs in the bullet come first,
     * then hints matching ledger terms, then the configured order.
     */
    public List<String> suggestVerbUpgrades(String verb, String context, Set<String> ledgerTerms) {
        VerbMapping mapping = lexicon.weakVerbs().get(verb.toLowerCase(Locale.ROOT).trim());
        if (mapping == null) {
            return List.of();
        }
        String contextLower = context == null ? "" : context.toLowerCase(Locale.ROOT);
        LinkedHashSet<String> ranked = new LinkedHashSet<>();
        mapping.contextHints().forEach((keyword, upgrade) -> {
            if (contextLower.contains(keyword)) {
                ranked.add(upgrade);
            }
        });
        mapping.contextHints().forEach((keyword, upgrade) -> {
            if (ledgerTerms.stream().anyMatch(term -> term.contains(keyword))) {
                ranked.add(upgrade);
            }
        });
        ranked.addAll(mapping.upgrades());
        return List.copyOf(ranked);
    }

    public boolean hasPassiveVoice(String text) {
        return text != null && lexicon.passivePatterns().stream().anyMatch(p -> p.matcher(text).find());
    }

    public Optional<String> extractFirstVerb(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = FIRST_WORD.matcher(text);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    public boolean startsWithStrongVerb(String text) {
        return extractFirstVerb(text)
                .map(v -> lexicon.strongVerbs().contains(v.toLowerCase(Locale.ROOT)))
                .orElse(false);
    }

    private boolean isCovered(boolean[] covered, int start, int end) {
        for (int i = start; i < end; i++) {
            if (covered[i]) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param verb    lexicon key that matched
     * @param matched text as it appears in the bullet
     */
    public record WeakVerbMatch(String verb, String matched, int start, int end) {}
}
