package com.resumeai.infrastructure.config;

import com.resumeai.domain.rewrite.model.EvidenceScope;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning for the rewrite engine. Missing sections fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "rewrite")
public record RewriteProperties(
        Llm llm,
        Thresholds thresholds,
        Features features,
        Defaults defaults,
        Parallel parallel,
        Lexicon lexicon
) {
    public RewriteProperties {
        llm = llm == null ? new Llm(2) : llm;
        thresholds = thresholds == null
                ? new Thresholds(2.0, 20, 200, 300, 2000, 20, 0.2, 0.3)
                : thresholds;
        features = features == null ? new Features(true, true, true, true) : features;
        defaults = defaults == null ? new Defaults(EvidenceScope.SECTION, true) : defaults;
        parallel = parallel == null ? new Parallel(3) : parallel;
        lexicon = lexicon == null
                ? new Lexicon("lexicon/verb-mapping.json", "lexicon/fluff-phrases.json",
                "lexicon/metric-patterns.json", "lexicon/tech-terms.json")
                : lexicon;
    }

    public static RewriteProperties defaults() {
        return new RewriteProperties(null, null, null, null, null, null);
    }

    /**
     * @param maxRetries retries after the first attempt
     */
    public record Llm(int maxRetries) {}

    /**
     * @param maxLengthMultiplier      improved/original length ratio before LENGTH_EXPLOSION
     * @param minBulletLength          shorter bullets are always worth rewriting
     * @param maxBulletLength          hard cap for a rewritten bullet
     * @param maxSummaryLength         hard cap for a rewritten summary
     * @param maxInputLength           inputs longer than this are rejected
     * @param maxSectionBullets        bullets accepted per section request
     * @param lowOverlapMin            Jaccard floor for the LOW_OVERLAP warning
     * @param evidenceOverlapThreshold span/evidence overlap under which a mapping is weak
     */
    public record Thresholds(double maxLengthMultiplier,
                             int minBulletLength,
                             int maxBulletLength,
                             int maxSummaryLength,
                             int maxInputLength,
                             int maxSectionBullets,
                             double lowOverlapMin,
                             double evidenceOverlapThreshold) {}

    public record Features(boolean evidenceAnchoredRewrite,
                           boolean sectionCoherencePass,
                           boolean meaningShiftCheck,
                           boolean retryOnValidationFailure) {}

    public record Defaults(EvidenceScope evidenceScope, boolean allowResumeEnrichment) {}

    public record Parallel(int maxConcurrency) {}

    /**
     * Classpath locations of the lexicon tables.
     */
    public record Lexicon(String verbMapping, String fluffPhrases, String metricPatterns, String techTerms) {}
}
