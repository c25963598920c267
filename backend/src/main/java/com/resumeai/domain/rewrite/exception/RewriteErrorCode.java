package com.resumeai.domain.rewrite.exception;

/**
 * Stable error codes surfaced to callers of the rewrite engine.
 */
public enum RewriteErrorCode {
    INVALID_INPUT("Invalid input", "Check that the text is not empty and within the length limit.", false),
    EVIDENCE_BUILD_ERROR("Evidence could not be built", "Check the extracted skills, tools and titles.", false),
    LLM_ERROR("Generation service error", "The rewrite service is temporarily unavailable. Try again shortly.", true),
    TIMEOUT("Generation timed out", "The rewrite took too long. Try again or shorten the text.", true),
    RATE_LIMIT("Too many requests", "Wait a moment before trying again.", true),
    FABRICATION_ERROR("Unsupported claim detected", "The rewrite added facts that are not in your resume.", false),
    MAX_RETRIES_EXCEEDED("Rewrite could not be verified", "Keep the original text or add the missing facts to your resume.", false),
    INTERNAL_ERROR("Internal error", "An unexpected error occurred. Try again later.", false);

    private final String title;
    private final String suggestion;
    private final boolean retryable;

    RewriteErrorCode(String title, String suggestion, boolean retryable) {
        this.title = title;
        this.suggestion = suggestion;
        this.retryable = retryable;
    }

    public String title() {
        return title;
    }

    public String suggestion() {
        return suggestion;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
