package com.multiangle.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

/**
 * A citation returned by the assistant service. Two sources with the same {@code sourceId} are the same citation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Source(
        @Nullable String sourceId,
        @Nullable String title,
        @Nullable String url,
        @Nullable String excerpt,
        @Nullable Integer pageNumber
) {

    public static Source of(String sourceId, String title, String url) {
        return new Source(sourceId, title, url, null, null);
    }
}
