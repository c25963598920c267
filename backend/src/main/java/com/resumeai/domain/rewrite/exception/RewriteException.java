package com.resumeai.domain.rewrite.exception;

import com.resumeai.domain.rewrite.model.ValidationItem;

import java.util.List;

public class RewriteException extends RuntimeException {

    private final RewriteErrorCode code;
    private final List<ValidationItem> diagnostics;

    public RewriteException(RewriteErrorCode code, String message) {
        this(code, message, List.of(), null);
    }

    public RewriteException(RewriteErrorCode code, String message, Throwable cause) {
        this(code, message, List.of(), cause);
    }

    public RewriteException(RewriteErrorCode code, String message, List<ValidationItem> diagnostics, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public RewriteErrorCode getCode() {
        return code;
    }

    public List<ValidationItem> getDiagnostics() {
        return diagnostics;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
