package com.multiangle.orchestration;

import com.multiangle.exception.AngleGenerationException;
import com.multiangle.orchestration.model.AngleResult;
import com.multiangle.orchestration.model.GenerationOptions;
import com.multiangle.orchestration.model.NormalizedResponse;
import com.multiangle.orchestration.model.OrchestrationResult;
import com.multiangle.orchestration.model.SynthesizedReport;
import com.multiangle.orchestration.service.AngleGenerator;
import com.multiangle.orchestration.service.ContradictionAnalyzer;
import com.multiangle.orchestration.service.FanOutCoordinator;
import com.multiangle.orchestration.service.OrchestrationMetricsService;
import com.multiangle.orchestration.service.ReportSynthesizer;
import com.multiangle.orchestration.service.ResponseNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Runs one query through Generate, Fan-Out-Resolve, Normalize, Analyze-Contradictions and Synthesize.
 *
 * <p>This is the single top-level recovery boundary: a stage that throws turns the whole result into
 * {@link OrchestrationResult#failed}. Branch faults and degraded stages are already encoded in the data by the time
 * they get here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrchestratorService {

    private final AngleGenerator angleGenerator;
    private final FanOutCoordinator fanOutCoordinator;
    private final ResponseNormalizer responseNormalizer;
    private final ContradictionAnalyzer contradictionAnalyzer;
    private final ReportSynthesizer reportSynthesizer;
    private final OrchestrationMetricsService metricsService;

    public OrchestrationResult orchestrate(String query) {
        return orchestrate(query, null, null);
    }

    public OrchestrationResult orchestrate(String query, @Nullable String provider, @Nullable String model) {
        metricsService.recordQuery();
        try {
            if (!StringUtils.hasText(query)) {
                throw new IllegalArgumentException("Query cannot be empty");
            }
            log.info("Starting orchestration for query: {}", query);
            GenerationOptions options = new GenerationOptions(OrchestrationConstants.PURPOSE_ANGLES, provider, model);

            log.info("Step 1: Generating analytical angles...");
            List<String> angles = angleGenerator.generate(query, options);
            if (angles == null || angles.isEmpty()) {
                throw new AngleGenerationException("No analytical angles were generated for the query");
            }

            log.info("Step 2: Resolving {} angles through the assistant service...", angles.size());
            List<AngleResult> results = fanOutCoordinator.resolveAll(query, angles);

            log.info("Step 3: Normalizing responses...");
            List<NormalizedResponse> normalized = responseNormalizer.normalize(results);
            log.info("Normalized {} of {} responses.", normalized.size(), results.size());

            log.info("Step 4: Checking for contradictions...");
            List<NormalizedResponse> analyzed = contradictionAnalyzer.analyze(normalized, options);

            log.info("Step 5: Synthesizing final report...");
            SynthesizedReport report = reportSynthesizer.synthesize(analyzed, query, options);

            // Zero usable responses still counts as a completed pipeline; the report carries no_valid_responses.
            log.info("Orchestration completed (responsesProcessed={}, reportError={}).",
                    analyzed.size(), report.error());
            return OrchestrationResult.completed(query, angles, analyzed, report);
        } catch (Exception ex) {
            log.error("Orchestration failed for query '{}': {}", query, ex.getMessage(), ex);
            return OrchestrationResult.failed(query, StringUtils.hasText(ex.getMessage())
                    ? ex.getMessage()
                    : ex.getClass().getSimpleName());
        } finally {
            metricsService.logSummary();
        }
    }
}
