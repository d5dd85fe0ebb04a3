package com.multiangle.orchestration.service;

import com.multiangle.orchestration.model.AngleResult;
import com.multiangle.orchestration.model.AssistantMessage;
import com.multiangle.orchestration.model.NormalizedResponse;
import com.multiangle.orchestration.model.Source;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
@Slf4j
public class ResponseNormalizer {

    public List<NormalizedResponse> normalize(List<AngleResult> results) {
        List<NormalizedResponse> normalized = new ArrayList<>(results.size());
        for (AngleResult result : results) {
            if (result == null || result.error() != null || result.data() == null) {
                continue;
            }
            if (result.isSoftTimeout()) {
                log.warn("Angle '{}' did not complete before the poll budget ran out (state={}). Keeping partial data.",
                        result.angle(), result.data().state());
            }
            normalized.add(project(result));
        }
        return List.copyOf(normalized);
    }

    private NormalizedResponse project(AngleResult result) {
        AssistantMessage data = result.data();
        List<Source> sources = data.sources() == null
                ? List.of()
                : data.sources().stream().filter(Objects::nonNull).toList();
        Map<String, Object> metadata = data.metadata() == null ? Map.of() : data.metadata();
        return new NormalizedResponse(
                result.angle(),
                Objects.requireNonNullElse(result.conversationId(), ""),
                Objects.requireNonNullElse(result.messageId(), ""),
                Objects.requireNonNullElse(data.content(), ""),
                sources,
                metadata,
                Objects.requireNonNullElse(data.timestamp(), ""),
                Objects.requireNonNullElse(data.status(), ""),
                null);
    }
}
