package com.resumeai.domain.rewrite.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RewriteStatus {
    PASSED,
    EXHAUSTED,
    SKIPPED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
