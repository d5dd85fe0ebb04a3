package com.multiangle.orchestration.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.multiangle.exception.TextGenerationException;
import com.multiangle.orchestration.api.TextGenerationService;
import com.multiangle.orchestration.model.ContradictionAnalysis;
import com.multiangle.orchestration.model.GenerationOptions;
import com.multiangle.orchestration.model.NormalizedResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContradictionAnalyzerTest {

    @Mock
    private TextGenerationService textGenerationService;

    private ContradictionAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ContradictionAnalyzer(textGenerationService, new OrchestrationPromptService(),
                new JsonProcessingService(new ObjectMapper()));
    }

    private static NormalizedResponse response(String angle, String content) {
        return new NormalizedResponse(angle, "c", "m", content, List.of(), Map.of(), "", "COMPLETED", null);
    }

    @Test
    void testSingleResponseIsReturnedUnchanged() {
        List<NormalizedResponse> input = List.of(response("only", "text"));

        List<NormalizedResponse> output = analyzer.analyze(input, GenerationOptions.defaults("test"));

        assertSame(input, output);
        verifyNoInteractions(textGenerationService);
    }

    @Test
    void testSameAnalysisAttachedToEveryResponse() {
        when(textGenerationService.complete(anyString(), any())).thenReturn("""
                ```json
                {"has_contradictions": true, "contradictions": ["Market size differs"], "confidence": 0.8}
                ```
                """);

        List<NormalizedResponse> output = analyzer.analyze(
                List.of(response("a", "market is 10B"), response("b", "market is 20B")), GenerationOptions.defaults("test"));

        assertEquals(2, output.size());
        ContradictionAnalysis analysis = output.get(0).contradictionAnalysis();
        assertNotNull(analysis);
        assertSame(analysis, output.get(1).contradictionAnalysis());
        assertTrue(analysis.hasContradictions());
        assertEquals(List.of("Market size differs"), analysis.contradictions());
        assertEquals(0.8, analysis.confidence(), 1e-9);
        assertFalse(analysis.isDegraded());
    }

    @Test
    void testPromptCarriesEveryAngleAndContent() {
        when(textGenerationService.complete(anyString(), any()))
                .thenReturn("{\"hasContradictions\": false, \"contradictions\": [], \"confidence\": 0.9}");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<GenerationOptions> options = ArgumentCaptor.forClass(GenerationOptions.class);

        analyzer.analyze(List.of(response("a", "alpha"), response("b", "beta")), GenerationOptions.defaults("x"));

        verify(textGenerationService).complete(prompt.capture(), options.capture());
        assertTrue(prompt.getValue().contains("Angle: a\nResponse: alpha"));
        assertTrue(prompt.getValue().contains("Angle: b\nResponse: beta"));
        assertEquals("contradiction-analysis", options.getValue().purpose());
    }

    @Test
    void testProviderFailureDegradesEveryResponse() {
        when(textGenerationService.complete(anyString(), any()))
                .thenThrow(new TextGenerationException("contradiction-analysis", "quota exceeded"));

        List<NormalizedResponse> output = assertDoesNotThrow(() -> analyzer.analyze(
                List.of(response("a", "x"), response("b", "y"), response("c", "z")), GenerationOptions.defaults("t")));

        assertEquals(3, output.size());
        for (NormalizedResponse response : output) {
            assertTrue(response.contradictionAnalysis().isDegraded());
            assertTrue(response.contradictionAnalysis().error().startsWith("Error analyzing contradictions: "));
            assertTrue(response.contradictionAnalysis().error().contains("quota exceeded"));
        }
    }

    @Test
    void testUnparseableReplyDegrades() {
        when(textGenerationService.complete(anyString(), any())).thenReturn("They broadly agree.");

        List<NormalizedResponse> output = analyzer.analyze(
                List.of(response("a", "x"), response("b", "y")), GenerationOptions.defaults("t"));

        assertTrue(output.get(0).contradictionAnalysis().isDegraded());
        assertTrue(output.get(0).contradictionAnalysis().error().contains("They broadly agree."));
    }

    @Test
    void testConfidenceIsClampedToUnitRange() {
        when(textGenerationService.complete(anyString(), any()))
                .thenReturn("{\"has_contradictions\": false, \"confidence\": 7}");

        List<NormalizedResponse> output = analyzer.analyze(
                List.of(response("a", "x"), response("b", "y")), GenerationOptions.defaults("t"));

        assertEquals(1.0, output.get(0).contradictionAnalysis().confidence(), 1e-9);
        assertEquals(List.of(), output.get(0).contradictionAnalysis().contradictions());
    }

    @Test
    void testObjectShapedContradictionsAreKept() {
        when(textGenerationService.complete(anyString(), any())).thenReturn("""
                {"has_contradictions": true,
                 "contradictions": [{"description": "A says 2030, B says 2040"}, {"angles": ["a", "b"]}, "Costs differ"],
                 "confidence": 0.7}
                """);

        List<NormalizedResponse> output = analyzer.analyze(
                List.of(response("a", "x"), response("b", "y")), GenerationOptions.defaults("t"));

        ContradictionAnalysis analysis = output.get(0).contradictionAnalysis();
        assertFalse(analysis.isDegraded());
        assertTrue(analysis.hasContradictions());
        assertEquals(0.7, analysis.confidence(), 1e-9);
        assertEquals(3, analysis.contradictions().size());
        assertEquals("A says 2030, B says 2040", analysis.contradictions().get(0));
        assertTrue(analysis.contradictions().get(1).contains("\"angles\""));
        assertEquals("Costs differ", analysis.contradictions().get(2));
    }

    @Test
    void testNonNumericConfidenceFallsBackToZero() {
        when(textGenerationService.complete(anyString(), any()))
                .thenReturn("{\"hasContradictions\": true, \"contradictions\": \"Dates differ\", \"confidence\": \"NaN\"}");

        ContradictionAnalysis analysis = analyzer.analyze(
                List.of(response("a", "x"), response("b", "y")), GenerationOptions.defaults("t")).get(0).contradictionAnalysis();

        assertEquals(0.0, analysis.confidence(), 1e-9);
        assertEquals(List.of("Dates differ"), analysis.contradictions());
        assertTrue(analysis.hasContradictions());
    }
}
