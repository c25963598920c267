package com.resumeai.infrastructure.ai.lexicon;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FluffCategory {
    FILLERS("fillers"),
    WEAK_DESCRIPTORS("weak_descriptors"),
    REDUNDANT_PHRASES("redundant_phrases"),
    VAGUE_PHRASES("vague_phrases"),
    HYPE_WORDS("hype_words"),
    UNNECESSARY_ADVERBS("unnecessary_adverbs"),
    CLICHES("cliches");

    private final String key;

    FluffCategory(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
