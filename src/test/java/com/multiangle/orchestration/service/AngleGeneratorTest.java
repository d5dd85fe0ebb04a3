package com.multiangle.orchestration.service;

import com.multiangle.exception.AngleGenerationException;
import com.multiangle.exception.TextGenerationException;
import com.multiangle.orchestration.api.TextGenerationService;
import com.multiangle.orchestration.model.GenerationOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AngleGeneratorTest {

    @Mock
    private TextGenerationService textGenerationService;

    private AngleGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new AngleGenerator(textGenerationService, new OrchestrationPromptService(),
                new OrchestrationMetricsService());
    }

    @Test
    void testTrimsLinesAndKeepsProviderOrder() {
        when(textGenerationService.complete(anyString(), any())).thenReturn(
                "  What are the core physical principles?  \n\n   \r\nWhat are current industry applications?\n");

        List<String> angles = generator.generate("What is quantum computing?",
                new GenerationOptions("ignored", "OPENAI", "gpt-4o"));

        assertEquals(List.of("What are the core physical principles?", "What are current industry applications?"), angles);
    }

    @Test
    void testPromptAndOptionsForwarded() {
        when(textGenerationService.complete(anyString(), any())).thenReturn("one");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<GenerationOptions> options = ArgumentCaptor.forClass(GenerationOptions.class);

        generator.generate("Why is the sky blue?", new GenerationOptions("x", "OPENAI", "gpt-4o"));

        verify(textGenerationService).complete(prompt.capture(), options.capture());
        assertTrue(prompt.getValue().contains("\"Why is the sky blue?\""));
        assertEquals("angle-generation", options.getValue().purpose());
        assertEquals("OPENAI", options.getValue().provider());
        assertEquals("gpt-4o", options.getValue().model());
    }

    @Test
    void testDoesNotEnforceMinimumOrMaximum() {
        when(textGenerationService.complete(anyString(), any())).thenReturn("a\nb\nc\nd\ne\nf\ng");

        assertEquals(7, generator.generate("q", GenerationOptions.defaults("x")).size());
    }

    @Test
    void testBlankReplyFails() {
        when(textGenerationService.complete(anyString(), any())).thenReturn(" \n \n");

        assertThrows(AngleGenerationException.class, () -> generator.generate("q", GenerationOptions.defaults("x")));
    }

    @Test
    void testProviderFailureFails() {
        when(textGenerationService.complete(anyString(), any()))
                .thenThrow(new TextGenerationException("angle-generation", "unauthorized"));

        AngleGenerationException ex = assertThrows(AngleGenerationException.class,
                () -> generator.generate("q", GenerationOptions.defaults("x")));
        assertTrue(ex.getMessage().contains("unauthorized"));
        assertInstanceOf(TextGenerationException.class, ex.getCause());
    }
}
