package com.multiangle.exception;

/** Thrown when no analytical angles could be generated for a query. */
public class AngleGenerationException extends RuntimeException {

    public AngleGenerationException(String message) {
        super(message);
    }

    public AngleGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
