package com.resumeai.domain.rewrite.model;

import java.util.List;
import java.util.Objects;

/**
 * Signals handed over by the resume analysis layer: extracted entities and bullets it flagged as weak.
 */
public record Layer1Signals(
        ExtractedEntities extracted,
        List<WeakBulletSignal> weakBullets
) {
    public Layer1Signals {
        extracted = extracted == null ? ExtractedEntities.empty() : extracted;
        weakBullets = weakBullets == null ? List.of() : List.copyOf(weakBullets);
    }

    public static Layer1Signals of(ExtractedEntities extracted) {
        return new Layer1Signals(extracted, List.of());
    }

    public static Layer1Signals empty() {
        return new Layer1Signals(ExtractedEntities.empty(), List.of());
    }

    public List<String> issuesFor(String bullet, int index) {
        return weakBullets.stream()
                .filter(wb -> Objects.equals(wb.bullet(), bullet)
                        || (wb.index() != null && wb.index() == index))
                .findFirst()
                .map(WeakBulletSignal::issues)
                .orElse(List.of());
    }
}
