package com.resumeai.domain.rewrite.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How far the ledger builder may look for facts.
 * BULLET_ONLY keeps sibling bullets out of the ledger; SECTION and RESUME include them.
 */
public enum EvidenceScope {
    BULLET_ONLY,
    SECTION,
    RESUME;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static EvidenceScope from(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
