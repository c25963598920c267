package com.resumeai.domain.rewrite.model;

public enum ValidationCode {
    NEW_NUMBER_ADDED(true),
    NEW_TOOL_ADDED(true),
    NEW_COMPANY_ADDED(true),
    UNSUPPORTED_SCALE_CLAIM(true),
    UNSUPPORTED_TOOL_CLAIM(true),
    UNSUPPORTED_METRIC_CLAIM(true),
    INVALID_EVIDENCE_ID(false),
    SPAN_NOT_FOUND(false),
    EMPTY_EVIDENCE_MAP(false),
    WEAK_EVIDENCE_MATCH(false),
    WEAK_VERB(false),
    LOW_OVERLAP(false),
    LENGTH_EXPLOSION(false);

    private final boolean fabrication;

    ValidationCode(boolean fabrication) {
        this.fabrication = fabrication;
    }

    public boolean isFabrication() {
        return fabrication;
    }
}
