package com.multiangle.orchestration.service;

import com.multiangle.config.MultiAngleProperties;
import com.multiangle.exception.AssistantServiceException;
import com.multiangle.orchestration.api.AssistantService;
import com.multiangle.orchestration.model.AssistantMessage;
import com.multiangle.orchestration.model.ConversationHandle;
import com.multiangle.orchestration.model.MessageState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationServiceTest {

    @Mock
    private AssistantService assistantService;

    private ExecutorService executor;
    private ConversationService conversationService;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        MultiAngleProperties properties = new MultiAngleProperties();
        properties.setPolling(new MultiAngleProperties.PollingConfig(Duration.ZERO, 3));
        AngleResolver resolver = new AngleResolver(assistantService, executor, new OrchestrationMetricsService(), properties);
        conversationService = new ConversationService(assistantService, resolver);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testFollowUpPollsUntilCompleted() {
        when(assistantService.sendFollowup("conv-1", "And the risks?")).thenReturn(new ConversationHandle(null, "msg-2"));
        when(assistantService.getMessage("conv-1", "msg-2")).thenReturn(
                AssistantMessage.of(MessageState.PENDING, "", List.of()),
                AssistantMessage.of(MessageState.COMPLETED, "Decoherence.", List.of()));

        AssistantMessage answer = conversationService.followUp("conv-1", "And the risks?");

        assertEquals(MessageState.COMPLETED, answer.state());
        assertEquals("Decoherence.", answer.content());
    }

    @Test
    void testFollowUpWithoutMessageIdFails() {
        when(assistantService.sendFollowup("conv-1", "more")).thenReturn(new ConversationHandle("conv-1", null));

        assertThrows(IllegalStateException.class, () -> conversationService.followUp("conv-1", "more"));
        verify(assistantService, never()).getMessage(anyString(), anyString());
    }

    @Test
    void testFollowUpTransportFailureIsRethrownUnwrapped() {
        when(assistantService.sendFollowup("conv-1", "more")).thenReturn(new ConversationHandle("conv-1", "msg-9"));
        when(assistantService.getMessage("conv-1", "msg-9"))
                .thenThrow(new AssistantServiceException("get-message", "down", 503, new RuntimeException()));

        assertThrows(AssistantServiceException.class, () -> conversationService.followUp("conv-1", "more"));
        verify(assistantService, times(3)).getMessage("conv-1", "msg-9");
    }

    @Test
    void testFeedbackDefaultsToSuccess() {
        when(assistantService.giveFeedback("msg-1", "success")).thenReturn(Map.of("ok", true));

        assertEquals(Map.of("ok", true), conversationService.giveFeedback("msg-1", "  "));
    }

    @Test
    void testFeedbackForwardsValue() {
        when(assistantService.giveFeedback("msg-1", "failure")).thenReturn(Map.of());

        conversationService.giveFeedback("msg-1", " failure ");

        verify(assistantService).giveFeedback("msg-1", "failure");
    }
}
