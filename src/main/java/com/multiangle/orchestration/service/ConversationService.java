package com.multiangle.orchestration.service;

import static com.multiangle.orchestration.OrchestrationConstants.DEFAULT_FEEDBACK;
import com.multiangle.orchestration.api.AssistantService;
import com.multiangle.orchestration.model.AssistantMessage;
import com.multiangle.orchestration.model.ConversationHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Follow-up questions and feedback on conversations opened while resolving angles.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private final AssistantService assistantService;
    private final AngleResolver angleResolver;

    public AssistantMessage followUp(String conversationId, String message) {
        ConversationHandle created = assistantService.sendFollowup(conversationId, message);
        if (created == null || !StringUtils.hasText(created.messageId())) {
            throw new IllegalStateException("Follow-up for conversation " + conversationId + " returned no message id");
        }
        ConversationHandle handle = new ConversationHandle(
                StringUtils.hasText(created.conversationId()) ? created.conversationId() : conversationId,
                created.messageId());
        log.info("Follow-up sent to conversation {} (message {}). Polling for the answer.",
                handle.conversationId(), handle.messageId());
        try {
            return angleResolver.pollMessage(handle).join();
        } catch (CompletionException ex) {
            Throwable cause = AngleResolver.unwrap(ex);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw ex;
        }
    }

    public Map<String, Object> giveFeedback(String messageId, String feedback) {
        String value = StringUtils.hasText(feedback) ? feedback.trim() : DEFAULT_FEEDBACK;
        log.info("Sending feedback '{}' for message {}.", value, messageId);
        return assistantService.giveFeedback(messageId, value);
    }
}
