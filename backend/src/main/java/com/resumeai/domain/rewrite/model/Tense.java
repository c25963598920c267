package com.resumeai.domain.rewrite.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Tense {
    PAST,
    PRESENT,
    OTHER;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
