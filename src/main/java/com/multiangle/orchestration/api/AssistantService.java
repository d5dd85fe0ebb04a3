package com.multiangle.orchestration.api;

import com.multiangle.exception.AssistantServiceException;
import com.multiangle.orchestration.model.AssistantMessage;
import com.multiangle.orchestration.model.ConversationHandle;

import java.util.Map;

/**
 * Conversational assistant that answers asynchronously. Completion is only observable by fetching the message
 * repeatedly. All methods throw {@link AssistantServiceException} on transport failure.
 */
public interface AssistantService {

    /**
     * Opens a conversation with {@code message} as the first user message.
     *
     * @param message The initial message.
     * @return The conversation and answer message identifiers as reported by the service.
     */
    ConversationHandle createConversation(String message);

    /**
     * Fetches the current state of a message. Idempotent.
     *
     * @param conversationId The conversation identifier.
     * @param messageId The message identifier.
     * @return The message with its current state.
     */
    AssistantMessage getMessage(String conversationId, String messageId);

    /**
     * Posts a follow-up message to an existing conversation.
     *
     * @param conversationId The conversation identifier.
     * @param message The follow-up text.
     * @return The identifiers of the new answer message.
     */
    ConversationHandle sendFollowup(String conversationId, String message);

    /**
     * Records feedback for an answer message.
     *
     * @param messageId The message identifier.
     * @param feedback The feedback value, for example {@code success}.
     * @return The raw acknowledgement returned by the service.
     */
    Map<String, Object> giveFeedback(String messageId, String feedback);
}
