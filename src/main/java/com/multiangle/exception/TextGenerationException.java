package com.multiangle.exception;

/** Exception thrown when the text-generation provider fails. */
public class TextGenerationException extends RuntimeException {

    private final String purpose;

    public TextGenerationException(String purpose, String message) {
        super(message);
        this.purpose = purpose;
    }

    public TextGenerationException(String purpose, String message, Throwable cause) {
        super(message, cause);
        this.purpose = purpose;
    }

    public String getPurpose() {
        return purpose;
    }
}
