package com.resumeai.domain.rewrite.model;

import java.util.List;

/**
 * Entities extracted from the resume by the upstream analysis layer.
 */
public record ExtractedEntities(
        List<String> skills,
        List<String> tools,
        List<String> titles,
        List<String> industries
) {
    public ExtractedEntities {
        skills = skills == null ? List.of() : skills;
        tools = tools == null ? List.of() : tools;
        titles = titles == null ? List.of() : titles;
        industries = industries == null ? List.of() : industries;
    }

    public static ExtractedEntities empty() {
        return new ExtractedEntities(List.of(), List.of(), List.of(), List.of());
    }

    public static ExtractedEntities ofSkills(List<String> skills) {
        return new ExtractedEntities(skills, List.of(), List.of(), List.of());
    }
}
