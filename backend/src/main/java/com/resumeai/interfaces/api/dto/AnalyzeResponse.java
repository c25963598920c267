package com.resumeai.interfaces.api.dto;

import com.resumeai.application.rewrite.TextAnalysis;

import java.util.List;

public record AnalyzeResponse(
        boolean canImprove,
        List<String> weakVerbs,
        List<String> fluff,
        List<String> metrics,
        List<String> impliedMetrics,
        List<String> suggestions
) {
    public static AnalyzeResponse from(TextAnalysis analysis) {
        return new AnalyzeResponse(
                analysis.canImprove(),
                analysis.weakVerbs(),
                analysis.fluff(),
                analysis.metrics(),
                analysis.impliedMetrics(),
                analysis.suggestions());
    }
}
