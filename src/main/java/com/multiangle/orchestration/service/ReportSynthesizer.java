package com.multiangle.orchestration.service;

import static com.multiangle.orchestration.OrchestrationConstants.*;
import com.multiangle.orchestration.api.TextGenerationService;
import com.multiangle.orchestration.model.GenerationOptions;
import com.multiangle.orchestration.model.NormalizedResponse;
import com.multiangle.orchestration.model.Source;
import com.multiangle.orchestration.model.SynthesizedReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReportSynthesizer {

    private final TextGenerationService textGenerationService;
    private final OrchestrationPromptService promptService;
    private final SourceDeduplicator sourceDeduplicator;

    public SynthesizedReport synthesize(List<NormalizedResponse> responses, String originalQuery,
                                        GenerationOptions options) {
        if (responses.isEmpty()) {
            log.warn("No valid responses to synthesize for query: {}", originalQuery);
            return SynthesizedReport.error(ERROR_NO_VALID_RESPONSES);
        }
        List<Source> sources = sourceDeduplicator.deduplicate(responses);
        List<String> angles = responses.stream().map(NormalizedResponse::angle).toList();
        try {
            String reportText = textGenerationService.complete(promptService.synthesisPrompt(originalQuery, responses),
                    options.forPurpose(PURPOSE_SYNTHESIS));
            log.info("Synthesized report from {} angles with {} unique sources.", angles.size(), sources.size());
            return SynthesizedReport.of(originalQuery, reportText, angles, sources);
        } catch (RuntimeException ex) {
            log.warn("Report synthesis failed: {}", ex.getMessage());
            return SynthesizedReport.error(SYNTHESIS_ERROR_PREFIX + ex.getMessage());
        }
    }
}
