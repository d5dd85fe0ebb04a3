package com.multiangle.orchestration.service;

import static com.multiangle.orchestration.OrchestrationConstants.PURPOSE_ANGLES;
import com.multiangle.exception.AngleGenerationException;
import com.multiangle.orchestration.api.TextGenerationService;
import com.multiangle.orchestration.model.GenerationOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;

/**
 * Turns a query into focused sub-questions. The provider's line order is kept; no minimum or maximum is enforced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AngleGenerator {

    private final TextGenerationService textGenerationService;
    private final OrchestrationPromptService promptService;
    private final OrchestrationMetricsService metricsService;

    public List<String> generate(String query, GenerationOptions options) {
        String reply;
        try {
            reply = textGenerationService.complete(promptService.angleGenerationPrompt(query),
                    options.forPurpose(PURPOSE_ANGLES));
        } catch (RuntimeException ex) {
            throw new AngleGenerationException("Failed to generate analysis angles: " + ex.getMessage(), ex);
        }
        List<String> angles = parseAngles(reply);
        if (angles.isEmpty()) {
            throw new AngleGenerationException("Angle generation returned no usable angles");
        }
        metricsService.recordAnglesGenerated(angles.size());
        log.info("Generated {} angles: {}", angles.size(), angles);
        return angles;
    }

    List<String> parseAngles(String reply) {
        if (!StringUtils.hasText(reply)) {
            return List.of();
        }
        return Arrays.stream(reply.split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
    }
}
