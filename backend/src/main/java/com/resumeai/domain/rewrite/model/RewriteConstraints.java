package com.resumeai.domain.rewrite.model;

import java.util.Locale;
import java.util.Set;

/**
 * Hard limits a rewrite must respect.
 * Numbers and company names are open vocabularies, so only their allowed sets are enumerated:
 * anything outside them is forbidden. Tools come from a finite lexicon, so the forbidden
 * tool set is explicit.
 */
public record RewriteConstraints(
        int maxLength,
        Set<String> allowedNumbers,
        Set<String> allowedTools,
        Set<String> allowedCompanies,
        Set<String> forbiddenTools
) {
    public RewriteConstraints {
        allowedNumbers = allowedNumbers == null ? Set.of() : Set.copyOf(allowedNumbers);
        allowedTools = allowedTools == null ? Set.of() : Set.copyOf(allowedTools);
        allowedCompanies = allowedCompanies == null ? Set.of() : Set.copyOf(allowedCompanies);
        forbiddenTools = forbiddenTools == null ? Set.of() : Set.copyOf(forbiddenTools);
    }

    public boolean forbidsTool(String tool) {
        return !allowedTools.contains(tool.toLowerCase(Locale.ROOT));
    }

    public boolean forbidsCompany(String company) {
        return allowedCompanies.stream().noneMatch(c -> c.equalsIgnoreCase(company));
    }
}
