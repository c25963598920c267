package com.resumeai.domain.rewrite.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RewriteGoal {
    IMPACT,
    CLARITY,
    CONCISENESS;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
