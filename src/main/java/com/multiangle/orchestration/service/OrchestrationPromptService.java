package com.multiangle.orchestration.service;

import static com.multiangle.orchestration.OrchestrationConstants.*;
import com.multiangle.orchestration.model.ContradictionAnalysis;
import com.multiangle.orchestration.model.NormalizedResponse;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Service
public class OrchestrationPromptService {

    public String angleGenerationPrompt(String query) {
        return ANGLE_GENERATION_PROMPT.formatted(query);
    }

    public String contradictionPrompt(List<NormalizedResponse> responses) {
        return CONTRADICTION_PROMPT.formatted(buildResponsesContext(responses));
    }

    public String synthesisPrompt(String originalQuery, List<NormalizedResponse> responses) {
        String prompt = SYNTHESIS_PROMPT.formatted(originalQuery, buildResponsesContext(responses));
        String contradictionNote = describeContradictions(responses);
        return StringUtils.hasText(contradictionNote)
                ? prompt + CONTRADICTION_CONTEXT_NOTE.formatted(contradictionNote)
                : prompt;
    }

    public String buildResponsesContext(List<NormalizedResponse> responses) {
        return responses.stream()
                .map(response -> "Angle: " + response.angle() + "\nResponse: " + response.content())
                .collect(Collectors.joining("\n"));
    }

    private String describeContradictions(List<NormalizedResponse> responses) {
        if (responses.isEmpty()) {
            return null;
        }
        ContradictionAnalysis analysis = responses.get(0).contradictionAnalysis();
        if (analysis == null || analysis.isDegraded() || !analysis.hasContradictions()) {
            return null;
        }
        return String.join("; ", analysis.contradictions())
                + " (confidence " + String.format(Locale.ROOT, "%.2f", analysis.confidence()) + ")";
    }
}
