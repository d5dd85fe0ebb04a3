package com.multiangle.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.UUID;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining("; "));
        log.warn("Validation failed [{}]: {}", errorId, message);
        return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
    }

    @ExceptionHandler(AssistantServiceException.class)
    public ResponseEntity<ApiError> handleAssistant(AssistantServiceException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Assistant service error [{}] during {}: {}", errorId, ex.getOperation(), ex.getMessage(), ex);
        return build(HttpStatus.BAD_GATEWAY, errorId, ApiError.ASSISTANT_UNAVAILABLE,
                "Assistant service request failed: " + ex.getOperation(), request);
    }

    @ExceptionHandler(TextGenerationException.class)
    public ResponseEntity<ApiError> handleTextGeneration(TextGenerationException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Text generation error [{}] for {}: {}", errorId, ex.getPurpose(), ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.LLM_UNAVAILABLE,
                "AI service is temporarily unavailable. Please try again later.", request);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String errorId, String code, String message,
                                           HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ApiError(errorId, code, message, request.getRequestURI(), Instant.now()));
    }

    private String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
