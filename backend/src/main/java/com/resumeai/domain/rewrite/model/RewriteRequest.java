package com.resumeai.domain.rewrite.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Closed set of rewrite request variants, discriminated by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BulletRewriteRequest.class, name = "bullet"),
        @JsonSubTypes.Type(value = SummaryRewriteRequest.class, name = "summary"),
        @JsonSubTypes.Type(value = SectionRewriteRequest.class, name = "section")
})
public sealed interface RewriteRequest permits BulletRewriteRequest, SummaryRewriteRequest, SectionRewriteRequest {

    @JsonIgnore
    RewriteType type();

    String targetRole();

    Layer1Signals layer1();

    EvidenceScope evidenceScope();

    Boolean allowResumeEnrichment();

    @JsonIgnore
    default ExtractedEntities entities() {
        return layer1() == null ? ExtractedEntities.empty() : layer1().extracted();
    }
}
