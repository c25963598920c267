package com.resumeai.domain.rewrite.model;

/**
 * Request sent to the text-generation backend.
 */
public record GenerationRequest(String system, String user, double temperature) {
}
