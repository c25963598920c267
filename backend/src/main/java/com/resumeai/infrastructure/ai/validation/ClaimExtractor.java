package com.resumeai.infrastructure.ai.validation;

import com.resumeai.infrastructure.ai.lexicon.RewriteLexicon;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern tables for claims that must be grounded: technology names and company names.
 */
@Component
public class ClaimExtractor {

    private static final String CAPITALIZED_RUN = "[A-Z][A-Za-z0-9&]*(?:\\s+[A-Z][A-Za-z0-9&]*)*";

    // Name introduced by a preposition: "at Stripe", "for Goldman Sachs", "with Microsoft"
    private static final Pattern PREPOSITION_COMPANY =
            Pattern.compile("\\b(?:at|for|with|by|from|via)\\s+(" + CAPITALIZED_RUN + ")");
    private static final Pattern SUFFIX_COMPANY =
            Pattern.compile("\\b(" + CAPITALIZED_RUN + "\\s+(?:Inc\\.?|Corp\\.?|Corporation|LLC|Ltd\\.?|GmbH|Technologies|Labs))");
    // Two or more capitalized words anywhere in the text
    private static final Pattern CAPITALIZED_SEQUENCE =
            Pattern.compile("\\b([A-Z][A-Za-z0-9&]*(?:\\s+[A-Z][A-Za-z0-9&]*)+)");
    private static final String SENTENCE_END = ".!?;:";

    private final RewriteLexicon lexicon;
    private final Map<String, Pattern> techTermPatterns;

    public ClaimExtractor(RewriteLexicon lexicon) {
        this.lexicon = lexicon;
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        lexicon.techTerms().forEach(term -> patterns.put(term, termPattern(term)));
        this.techTermPatterns = Collections.unmodifiableMap(patterns);
    }

    /**
     * Lexicon technology terms present in the text, lower-case, in lexicon order.
     */
    public List<String> extractTechTerms(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return techTermPatterns.entrySet().stream()
                .filter(entry -> entry.getValue().matcher(lower).find())
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean mentionsTerm(String text, String term) {
        if (text == null || term == null) {
            return false;
        }
        Pattern pattern = techTermPatterns.getOrDefault(term.toLowerCase(Locale.ROOT), termPattern(term.toLowerCase(Locale.ROOT)));
        return pattern.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * Capitalized sequences that read like an employer or vendor name. Stop words, tech terms,
     * job-title words and strong verbs are trimmed from both ends of each candidate.
     */
    public List<String> extractCompanies(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> companies = new LinkedHashSet<>();
        collect(PREPOSITION_COMPANY, text, 1, Integer.MAX_VALUE, companies);
        collect(SUFFIX_COMPANY, text, 2, 2, companies);
        collect(CAPITALIZED_SEQUENCE, text, 2, 0, companies);
        return List.copyOf(companies);
    }

    /**
     * @param sentenceStartKeep a sentence-initial word is dropped only when more words than this remain
     */
    private void collect(Pattern pattern, String text, int minWords, int sentenceStartKeep, Set<String> companies) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            List<String> words = new ArrayList<>(Arrays.asList(m.group(1).trim().split("\\s+")));
            // Sentence-initial words are capitalized anyway
            if (words.size() > sentenceStartKeep && isSentenceStart(text, m.start(1))) {
                words.remove(0);
            }
            while (!words.isEmpty() && isNonCompanyWord(words.get(0))) {
                words.remove(0);
            }
            while (!words.isEmpty() && isNonCompanyWord(words.get(words.size() - 1))) {
                words.remove(words.size() - 1);
            }
            if (words.size() >= minWords) {
                companies.add(String.join(" ", words));
            }
        }
    }

    private boolean isNonCompanyWord(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return lexicon.companyStopWords().contains(lower)
                || lexicon.titleWords().contains(lower)
                || lexicon.techTerms().contains(lower)
                || lexicon.strongVerbs().contains(lower);
    }

    private static boolean isSentenceStart(String text, int start) {
        String before = text.substring(0, start).strip();
        if (before.chars().noneMatch(Character::isLetterOrDigit)) {
            return true;
        }
        return SENTENCE_END.indexOf(before.charAt(before.length() - 1)) >= 0;
    }

    public Set<String> techTerms() {
        return lexicon.techTerms();
    }

    private static Pattern termPattern(String term) {
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(term) + "(?![a-z0-9+#])");
    }
}
