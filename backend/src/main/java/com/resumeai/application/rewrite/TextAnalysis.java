package com.resumeai.application.rewrite;

import java.util.List;

/**
 * Read-only probes over a bullet, used for UI hints before any rewrite is requested.
 */
public record TextAnalysis(
        boolean canImprove,
        List<String> weakVerbs,
        List<String> fluff,
        List<String> metrics,
        List<String> impliedMetrics,
        List<String> suggestions
) {}
