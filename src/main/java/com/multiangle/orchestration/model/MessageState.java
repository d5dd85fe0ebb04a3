package com.multiangle.orchestration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.springframework.lang.Nullable;

import java.util.Locale;

public enum MessageState {
    PENDING(0),
    PROCESSING(1),
    UNKNOWN(1),
    COMPLETED(2),
    FAILED(2);

    private final int stage;

    MessageState(int stage) {
        this.stage = stage;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * True when moving from {@code previous} to this state would go backwards in the lifecycle.
     */
    public boolean regressesFrom(@Nullable MessageState previous) {
        return previous != null && stage < previous.stage;
    }

    @JsonCreator
    public static MessageState from(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "PENDING", "QUEUED" -> PENDING;
            case "PROCESSING", "IN_PROGRESS", "RUNNING" -> PROCESSING;
            case "COMPLETED", "COMPLETE" -> COMPLETED;
            case "FAILED", "ERROR" -> FAILED;
            default -> UNKNOWN;
        };
    }
}
