package com.resumeai.infrastructure.ai;

import com.resumeai.domain.rewrite.exception.RewriteErrorCode;
import com.resumeai.domain.rewrite.exception.RewriteException;

/**
 * Failure of the generation backend: TIMEOUT, RATE_LIMIT or LLM_ERROR.
 */
public class AiGenerationException extends RewriteException {

    public AiGenerationException(RewriteErrorCode code, String message) {
        super(code, message);
    }

    public AiGenerationException(RewriteErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
