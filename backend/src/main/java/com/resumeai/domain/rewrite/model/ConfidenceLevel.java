package com.resumeai.domain.rewrite.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
