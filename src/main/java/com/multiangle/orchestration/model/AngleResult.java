package com.multiangle.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.lang.Nullable;

/**
 * Outcome of resolving one angle. Exactly one of {@code data} and {@code error} is present.
 */
public record AngleResult(
        String angle,
        @Nullable String conversationId,
        @Nullable String messageId,
        @Nullable AssistantMessage data,
        @Nullable String error
) {

    public AngleResult {
        if ((data == null) == (error == null)) {
            throw new IllegalArgumentException("AngleResult must carry either data or an error, not both or neither");
        }
    }

    public static AngleResult success(String angle, ConversationHandle handle, AssistantMessage data) {
        return new AngleResult(angle, handle.conversationId(), handle.messageId(), data, null);
    }

    public static AngleResult failure(String angle, String error) {
        return new AngleResult(angle, null, null, null, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * A successful fetch whose message never reached {@link MessageState#COMPLETED} before the poll budget ran out.
     */
    @JsonIgnore
    public boolean isSoftTimeout() {
        return data != null && data.state() != MessageState.COMPLETED;
    }
}
