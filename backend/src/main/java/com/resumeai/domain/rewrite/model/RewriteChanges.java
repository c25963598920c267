package com.resumeai.domain.rewrite.model;

/**
 * What the generator claims to have changed.
 */
public record RewriteChanges(
        boolean strongerVerb,
        boolean addedMetric,
        boolean moreSpecific,
        boolean removedFluff,
        boolean tailoredToRole
) {
    public static RewriteChanges none() {
        return new RewriteChanges(false, false, false, false, false);
    }
}
