package com.resumeai.domain.rewrite.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RewriteType {
    BULLET,
    SUMMARY,
    SECTION;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
