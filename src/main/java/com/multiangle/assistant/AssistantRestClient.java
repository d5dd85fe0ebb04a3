package com.multiangle.assistant;

import com.multiangle.exception.AssistantServiceException;
import com.multiangle.orchestration.api.AssistantService;
import com.multiangle.orchestration.model.AssistantMessage;
import com.multiangle.orchestration.model.ConversationHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Map;
import java.util.function.Supplier;

/**
 * REST client for the assistant service's conversation API.
 */
@Component
@Slf4j
public class AssistantRestClient implements AssistantService {

    static final String CONVERSATIONS_PATH = "/assistant/conversations";
    static final String MESSAGE_PATH = "/assistant/conversations/{conversationId}/messages/{messageId}";
    static final String MESSAGES_PATH = "/assistant/conversations/{conversationId}/messages";
    static final String FEEDBACK_PATH = "/assistant/messages/{messageId}/feedback";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public AssistantRestClient(@Qualifier("assistantRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public ConversationHandle createConversation(String message) {
        return execute("create-conversation", () -> restClient.post()
                .uri(CONVERSATIONS_PATH)
                .body(new MessageRequest(message))
                .retrieve()
                .body(ConversationHandle.class));
    }

    @Override
    public AssistantMessage getMessage(String conversationId, String messageId) {
        return execute("get-message", () -> restClient.get()
                .uri(MESSAGE_PATH, conversationId, messageId)
                .retrieve()
                .body(AssistantMessage.class));
    }

    @Override
    public ConversationHandle sendFollowup(String conversationId, String message) {
        return execute("send-followup", () -> restClient.post()
                .uri(MESSAGES_PATH, conversationId)
                .body(new MessageRequest(message))
                .retrieve()
                .body(ConversationHandle.class));
    }

    @Override
    public Map<String, Object> giveFeedback(String messageId, String feedback) {
        Map<String, Object> body = execute("give-feedback", () -> restClient.post()
                .uri(FEEDBACK_PATH, messageId)
                .body(new FeedbackRequest(feedback))
                .retrieve()
                .body(JSON_OBJECT));
        return body != null ? body : Map.of();
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException ex) {
            log.warn("Assistant {} returned HTTP {}: {}", operation, ex.getStatusCode().value(), ex.getResponseBodyAsString());
            throw new AssistantServiceException(operation,
                    "Assistant " + operation + " failed with HTTP " + ex.getStatusCode().value(),
                    ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            log.warn("Assistant {} failed: {}", operation, ex.getMessage());
            throw new AssistantServiceException(operation, "Assistant " + operation + " failed: " + ex.getMessage(),
                    null, ex);
        }
    }

    record MessageRequest(String message) {}

    record FeedbackRequest(String feedback) {}
}
