package com.multiangle.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Outward result of one query. On failure only {@code success}, {@code originalQuery} and {@code error} are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrchestrationResult(
        boolean success,
        String originalQuery,
        @Nullable List<String> anglesGenerated,
        int responsesProcessed,
        @Nullable SynthesizedReport finalReport,
        @Nullable List<NormalizedResponse> rawResponses,
        @Nullable String error
) {

    public static OrchestrationResult completed(String originalQuery, List<String> angles,
                                                List<NormalizedResponse> responses, SynthesizedReport report) {
        return new OrchestrationResult(true, originalQuery, List.copyOf(angles), responses.size(), report,
                List.copyOf(responses), null);
    }

    public static OrchestrationResult failed(String originalQuery, String error) {
        return new OrchestrationResult(false, originalQuery, null, 0, null, null, error);
    }
}
