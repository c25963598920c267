package com.resumeai.domain.rewrite.service;

import com.resumeai.domain.rewrite.model.GenerationRequest;
import com.resumeai.domain.rewrite.model.GenerationResult;

/**
 * Text-generation collaborator used by the rewrite pipeline.
 */
public interface GenerationBackend {

    /**
     * Generate a reply for the given instructions. Waits a bounded time.
     *
     * @param request system/user instructions and sampling temperature
     * @return the raw reply, expected to contain one JSON object
     * @throws com.resumeai.domain.rewrite.exception.RewriteException with code
     *         TIMEOUT, RATE_LIMIT or LLM_ERROR when the backend fails
     */
    GenerationResult generate(GenerationRequest request);

    /**
     * @return false when the backend is not configured and no call should be attempted
     */
    boolean isAvailable();
}
