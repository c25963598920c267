package com.resumeai.interfaces.api.dto;

import com.resumeai.domain.rewrite.model.RewriteResult;

import java.util.List;

public record ParallelRewriteResponse(
        List<RewriteResult> results,
        int passed,
        int total
) {
    public static ParallelRewriteResponse of(List<RewriteResult> results) {
        int passed = (int) results.stream().filter(r -> r.validation().passed()).count();
        return new ParallelRewriteResponse(results, passed, results.size());
    }
}
