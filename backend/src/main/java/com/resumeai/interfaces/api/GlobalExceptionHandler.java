package com.resumeai.interfaces.api;

import com.resumeai.domain.rewrite.exception.RewriteException;
import com.resumeai.interfaces.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(RewriteException.class)
    public ResponseEntity<ErrorResponse> handleRewrite(RewriteException e) {
        HttpStatus status = switch (e.getCode()) {
            case INVALID_INPUT, EVIDENCE_BUILD_ERROR -> HttpStatus.BAD_REQUEST;
            case LLM_ERROR, TIMEOUT, RATE_LIMIT -> HttpStatus.SERVICE_UNAVAILABLE;
            case MAX_RETRIES_EXCEEDED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case FABRICATION_ERROR, INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.warn("[GlobalExceptionHandler] Rewrite failed - {}: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getCode().name(),
                        e.getMessage() + " " + e.getCode().suggestion(),
                        e.getDiagnostics()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request.");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_INPUT", "Request body is malformed or has an unknown type."));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred. Try again later."));
    }
}
