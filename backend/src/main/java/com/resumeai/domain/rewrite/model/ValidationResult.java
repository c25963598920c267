package com.resumeai.domain.rewrite.model;

import java.util.List;

/**
 * Result of fabrication validation.
 *
 * @param passed true iff no CRITICAL item was found
 * @param items  every finding, critical and warning
 */
public record ValidationResult(
        boolean passed,
        List<ValidationItem> items
) {
    public ValidationResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static ValidationResult of(List<ValidationItem> items) {
        return new ValidationResult(items.stream().noneMatch(ValidationItem::isCritical), items);
    }

    public static ValidationResult clean() {
        return new ValidationResult(true, List.of());
    }

    public List<ValidationItem> criticalErrors() {
        return items.stream().filter(ValidationItem::isCritical).toList();
    }

    public List<ValidationItem> warnings() {
        return items.stream().filter(i -> !i.isCritical()).toList();
    }

    public boolean hasFabricationErrors() {
        return items.stream().anyMatch(i -> i.code().isFabrication());
    }

    public boolean hasCode(ValidationCode code) {
        return items.stream().anyMatch(i -> i.code() == code);
    }
}
