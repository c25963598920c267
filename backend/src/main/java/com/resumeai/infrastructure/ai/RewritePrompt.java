package com.resumeai.infrastructure.ai;

/**
 * System/user instruction pair for one generation call.
 */
public record RewritePrompt(String system, String user) {

    public RewritePrompt withUserSuffix(String suffix) {
        return new RewritePrompt(system, user + suffix);
    }
}
