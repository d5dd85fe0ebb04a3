package com.multiangle.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.multiangle.orchestration.model.NormalizedResponse;
import com.multiangle.orchestration.model.OrchestrationResult;
import com.multiangle.orchestration.model.SynthesizedReport;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(
        String requestId,
        Instant createdAt,
        boolean success,
        String originalQuery,
        List<String> anglesGenerated,
        int responsesProcessed,
        SynthesizedReport finalReport,
        List<NormalizedResponse> rawResponses,
        String error
) {

    public static QueryResponse from(OrchestrationResult result) {
        return new QueryResponse(UUID.randomUUID().toString(), Instant.now(),
                result.success(), result.originalQuery(),
                result.anglesGenerated() != null ? result.anglesGenerated() : List.of(),
                result.responsesProcessed(), result.finalReport(),
                result.rawResponses() != null ? result.rawResponses() : List.of(),
                result.error());
    }
}
