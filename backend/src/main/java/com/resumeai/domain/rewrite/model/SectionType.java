package com.resumeai.domain.rewrite.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SectionType {
    EXPERIENCE,
    SUMMARY,
    SKILLS,
    HEADLINE,
    PROJECTS;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SectionType from(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
