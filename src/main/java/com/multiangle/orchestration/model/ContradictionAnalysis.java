package com.multiangle.orchestration.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Batch-level judgment on whether the angle responses disagree. The same instance is attached to every response of
 * a batch. A degraded analysis carries {@code error} instead of a judgment.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContradictionAnalysis(
        @JsonAlias("has_contradictions") boolean hasContradictions,
        List<String> contradictions,
        double confidence,
        @Nullable String error
) {

    public ContradictionAnalysis {
        contradictions = contradictions == null ? List.of() : List.copyOf(contradictions);
        confidence = Double.isFinite(confidence) ? Math.max(0.0, Math.min(1.0, confidence)) : 0.0;
    }

    public static ContradictionAnalysis degraded(String error) {
        return new ContradictionAnalysis(false, List.of(), 0.0, error);
    }

    @JsonIgnore
    public boolean isDegraded() {
        return error != null;
    }
}
