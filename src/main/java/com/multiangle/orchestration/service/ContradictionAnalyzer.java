package com.multiangle.orchestration.service;

import static com.multiangle.orchestration.OrchestrationConstants.CONTRADICTION_ERROR_PREFIX;
import static com.multiangle.orchestration.OrchestrationConstants.PURPOSE_CONTRADICTIONS;
import com.fasterxml.jackson.databind.JsonNode;
import com.multiangle.orchestration.api.TextGenerationService;
import com.multiangle.orchestration.model.ContradictionAnalysis;
import com.multiangle.orchestration.model.GenerationOptions;
import com.multiangle.orchestration.model.NormalizedResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags disagreement across angles. The judgment is batch-level and attached identically to every response.
 * Never fails the batch: provider errors become a degraded analysis.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContradictionAnalyzer {

    private static final List<String> DESCRIPTION_FIELDS = List.of("description", "contradiction", "summary", "text");

    private final TextGenerationService textGenerationService;
    private final OrchestrationPromptService promptService;
    private final JsonProcessingService jsonProcessingService;

    public List<NormalizedResponse> analyze(List<NormalizedResponse> responses, GenerationOptions options) {
        if (responses.size() < 2) {
            return responses;
        }
        ContradictionAnalysis analysis = requestAnalysis(responses, options);
        log.info("Contradiction analysis: hasContradictions={}, confidence={}, degraded={}.",
                analysis.hasContradictions(), analysis.confidence(), analysis.isDegraded());
        return responses.stream()
                .map(response -> response.withContradictionAnalysis(analysis))
                .toList();
    }

    private ContradictionAnalysis requestAnalysis(List<NormalizedResponse> responses, GenerationOptions options) {
        String reply;
        try {
            reply = textGenerationService.complete(promptService.contradictionPrompt(responses),
                    options.forPurpose(PURPOSE_CONTRADICTIONS));
        } catch (RuntimeException ex) {
            log.warn("Contradiction analysis failed: {}", ex.getMessage());
            return ContradictionAnalysis.degraded(CONTRADICTION_ERROR_PREFIX + ex.getMessage());
        }
        JsonNode parsed = jsonProcessingService.parseJsonResponse(PURPOSE_CONTRADICTIONS, reply, JsonNode.class);
        if (parsed == null || !parsed.isObject()) {
            return ContradictionAnalysis.degraded(CONTRADICTION_ERROR_PREFIX + "unparseable analysis: "
                    + jsonProcessingService.truncate(reply, 240));
        }
        return toAnalysis(parsed);
    }

    /**
     * Reads the reply field by field. Contradiction entries may be plain strings or objects; objects are reduced to
     * their description text. A provider-supplied "error" key is ignored.
     */
    private ContradictionAnalysis toAnalysis(JsonNode root) {
        JsonNode flag = root.has("has_contradictions") ? root.get("has_contradictions") : root.path("hasContradictions");
        List<String> contradictions = new ArrayList<>();
        JsonNode items = root.path("contradictions");
        if (items.isArray()) {
            for (JsonNode item : items) {
                String text = describe(item);
                if (StringUtils.hasText(text)) {
                    contradictions.add(text);
                }
            }
        } else if (items.isTextual() && StringUtils.hasText(items.asText())) {
            contradictions.add(items.asText().trim());
        }
        return new ContradictionAnalysis(flag.asBoolean(false), contradictions, root.path("confidence").asDouble(0.0),
                null);
    }

    private @Nullable String describe(JsonNode item) {
        if (item.isNull() || item.isMissingNode()) {
            return null;
        }
        if (item.isValueNode()) {
            return item.asText().trim();
        }
        if (item.isObject()) {
            for (String field : DESCRIPTION_FIELDS) {
                JsonNode value = item.get(field);
                if (value != null && value.isTextual() && StringUtils.hasText(value.asText())) {
                    return value.asText().trim();
                }
            }
        }
        return item.toString();
    }
}
