package com.multiangle.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NormalizedResponse(
        String angle,
        String conversationId,
        String messageId,
        String content,
        List<Source> sources,
        Map<String, Object> metadata,
        String timestamp,
        String status,
        @Nullable ContradictionAnalysis contradictionAnalysis
) {

    public NormalizedResponse withContradictionAnalysis(ContradictionAnalysis analysis) {
        return new NormalizedResponse(angle, conversationId, messageId, content, sources, metadata, timestamp,
                status, analysis);
    }
}
