package com.resumeai.domain.rewrite.model;

/**
 * Where a bullet sits in the resume.
 */
public record BulletContext(
        SectionType sectionType,
        String role,
        String company,
        Integer index
) {
    public static BulletContext of(SectionType sectionType) {
        return new BulletContext(sectionType, null, null, null);
    }
}
