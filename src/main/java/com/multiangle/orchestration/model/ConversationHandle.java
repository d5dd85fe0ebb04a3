package com.multiangle.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.lang.Nullable;

/**
 * Identifiers returned by the assistant service when a conversation (or a follow-up message) is created.
 * Either field may be missing when the remote response is malformed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationHandle(
        @Nullable String conversationId,
        @Nullable String messageId
) {
}
