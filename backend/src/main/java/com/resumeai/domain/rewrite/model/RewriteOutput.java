package com.resumeai.domain.rewrite.model;

/**
 * Any result the engine hands back to a caller.
 */
public sealed interface RewriteOutput permits RewriteResult, SectionRewriteResult {

    RewriteType type();
}
