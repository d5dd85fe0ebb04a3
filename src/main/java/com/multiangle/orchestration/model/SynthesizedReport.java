package com.multiangle.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SynthesizedReport(
        @Nullable String originalQuery,
        @Nullable String reportText,
        List<String> sourceAngles,
        int totalAnglesProcessed,
        List<Source> sources,
        @Nullable String error
) {

    public static SynthesizedReport of(String originalQuery, String reportText, List<String> sourceAngles,
                                       List<Source> sources) {
        return new SynthesizedReport(originalQuery, reportText, List.copyOf(sourceAngles), sourceAngles.size(),
                List.copyOf(sources), null);
    }

    public static SynthesizedReport error(String error) {
        return new SynthesizedReport(null, null, List.of(), 0, List.of(), error);
    }
}
