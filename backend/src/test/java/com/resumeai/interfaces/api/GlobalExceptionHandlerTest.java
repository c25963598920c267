package com.resumeai.interfaces.api;

import com.resumeai.domain.rewrite.exception.RewriteErrorCode;
import com.resumeai.domain.rewrite.exception.RewriteException;
import com.resumeai.domain.rewrite.model.ValidationCode;
import com.resumeai.domain.rewrite.model.ValidationItem;
import com.resumeai.interfaces.api.dto.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void invalid_input_is_bad_request() {
        ResponseEntity<ErrorResponse> response = handler.handleRewrite(
                new RewriteException(RewriteErrorCode.INVALID_INPUT, "Bullet text is required"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().code()).isEqualTo("INVALID_INPUT");
        assertThat(response.getBody().message())
                .startsWith("Bullet text is required ")
                .endsWith(RewriteErrorCode.INVALID_INPUT.suggestion());
    }

    @Test
    void backend_failures_are_service_unavailable() {
        assertThat(handler.handleRewrite(new RewriteException(RewriteErrorCode.TIMEOUT, "slow")).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(handler.handleRewrite(new RewriteException(RewriteErrorCode.RATE_LIMIT, "busy")).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void diagnostics_are_passed_through() {
        List<ValidationItem> diagnostics = List.of(
                ValidationItem.critical(ValidationCode.NEW_TOOL_ADDED, "Tool \"kafka\" is not in the evidence ledger"));

        ResponseEntity<ErrorResponse> response = handler.handleRewrite(new RewriteException(
                RewriteErrorCode.MAX_RETRIES_EXCEEDED, "Rewrite could not be verified", diagnostics, null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().diagnostics()).isEqualTo(diagnostics);
    }

    @Test
    void unexpected_errors_hide_details() {
        ResponseEntity<ErrorResponse> response = handler.handleUnexpected(new IllegalStateException("secret"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().message()).doesNotContain("secret");
    }
}
