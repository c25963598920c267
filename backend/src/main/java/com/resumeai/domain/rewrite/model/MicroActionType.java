package com.resumeai.domain.rewrite.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MicroActionType {
    VERB_UPGRADE,
    FLUFF_REMOVAL,
    METRIC_SURFACING,
    TOOL_SURFACING,
    SPECIFICITY_INCREASE,
    ROLE_TAILORING,
    TENSE_ALIGN;

    /**
     * Surfacing actions introduce content into the bullet, so they must point at evidence.
     */
    public boolean requiresEvidence() {
        return this == METRIC_SURFACING || this == TOOL_SURFACING;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
