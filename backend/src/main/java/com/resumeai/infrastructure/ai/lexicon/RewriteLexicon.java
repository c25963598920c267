package com.resumeai.infrastructure.ai.lexicon;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable lexicon tables loaded once at startup and shared across requests.
 *
 * @param weakVerbs          weak verb phrase (lower-case) to its upgrades
 * @param weakStartPhrases   phrases that make a weak bullet opening
 * @param strongVerbs        past-tense action verbs considered strong
 * @param verbForms          base form to past form, used for tense conversion
 * @param passivePatterns    passive-voice detectors
 * @param fluffPhrases       fluff phrases per category
 * @param fluffReplacements  redundant phrase to its concise replacement
 * @param metricPatterns     metric type to detector, in priority order
 * @param impliedMetrics     quantifiable-but-unquantified phrases
 * @param scaleClaims        scale language that must be grounded
 * @param techTerms          known technology names (lower-case)
 * @param toolRelevance      tool to keywords that make it relevant to a bullet
 * @param companyStopWords   capitalized words never treated as company names
 * @param titleWords         job-title and org-unit words, never part of a company name
 */
public record RewriteLexicon(
        Map<String, VerbMapping> weakVerbs,
        List<String> weakStartPhrases,
        Set<String> strongVerbs,
        Map<String, String> verbForms,
        List<Pattern> passivePatterns,
        Map<FluffCategory, List<String>> fluffPhrases,
        Map<String, String> fluffReplacements,
        Map<String, Pattern> metricPatterns,
        List<String> impliedMetrics,
        List<String> scaleClaims,
        Set<String> techTerms,
        Map<String, List<String>> toolRelevance,
        Set<String> companyStopWords,
        Set<String> titleWords
) {
    /**
     * @param upgrades     strong replacements in preference order
     * @param contextHints keyword found in the bullet to the preferred upgrade
     */
    public record VerbMapping(List<String> upgrades, Map<String, String> contextHints) {}
}
