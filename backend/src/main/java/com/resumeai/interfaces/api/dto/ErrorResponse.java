package com.resumeai.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.resumeai.domain.rewrite.model.ValidationItem;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        String code,
        String message,
        List<ValidationItem> diagnostics
) {
    public ErrorResponse(String code, String message) {
        this(code, message, List.of());
    }
}
