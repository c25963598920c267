package com.resumeai.domain.rewrite.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Individual finding produced by the fabrication validator.
 *
 * @param code     stable finding code
 * @param severity CRITICAL fails validation and triggers a retry, WARNING is informational
 * @param message  human-readable description
 */
public record ValidationItem(
        ValidationCode code,
        Severity severity,
        String message
) {
    public enum Severity {
        CRITICAL,
        WARNING;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }

    public static ValidationItem critical(ValidationCode code, String message) {
        return new ValidationItem(code, Severity.CRITICAL, message);
    }

    public static ValidationItem warning(ValidationCode code, String message) {
        return new ValidationItem(code, Severity.WARNING, message);
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }

    public ValidationItem withMessagePrefix(String prefix) {
        return new ValidationItem(code, severity, prefix + message);
    }
}
