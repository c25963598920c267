package com.resumeai.domain.rewrite.model;

import java.util.List;

public record WeakBulletSignal(
        String bullet,
        Integer index,
        List<String> issues
) {
    public WeakBulletSignal {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
