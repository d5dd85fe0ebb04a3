package com.multiangle.orchestration.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * A message as fetched from the assistant service. {@code state} is the poll signal; {@code status} keeps the raw
 * value the service reported.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssistantMessage(
        @Nullable @JsonAlias("id") String messageId,
        @Nullable MessageState state,
        @Nullable String status,
        @Nullable String content,
        @Nullable List<Source> sources,
        @Nullable Map<String, Object> metadata,
        @Nullable String timestamp,
        @Nullable String error
) {

    public AssistantMessage {
        if (state == null) {
            state = MessageState.from(status);
        }
        if (status == null) {
            status = state.name();
        }
    }

    public static AssistantMessage of(MessageState state, String content, List<Source> sources) {
        return new AssistantMessage(null, state, null, content, sources, null, null, null);
    }
}
