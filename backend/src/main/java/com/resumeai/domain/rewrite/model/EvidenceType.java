package com.resumeai.domain.rewrite.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of content an evidence item was derived from.
 */
public enum EvidenceType {
    SKILLS,
    TOOLS,
    TITLES,
    INDUSTRIES,
    BULLET,
    SECTION;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static EvidenceType from(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
