package com.multiangle.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String errorId,
        String code,
        String message,
        String path,
        Instant timestamp
) {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String ASSISTANT_UNAVAILABLE = "ASSISTANT_UNAVAILABLE";
    public static final String LLM_UNAVAILABLE = "LLM_UNAVAILABLE";
}
