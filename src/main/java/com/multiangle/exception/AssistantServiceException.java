package com.multiangle.exception;

import org.springframework.lang.Nullable;

/** Transport-level failure talking to the assistant service. */
public class AssistantServiceException extends RuntimeException {

    private final String operation;
    @Nullable
    private final Integer statusCode;

    public AssistantServiceException(String operation, String message, @Nullable Integer statusCode, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public String getOperation() {
        return operation;
    }

    @Nullable
    public Integer getStatusCode() {
        return statusCode;
    }
}
