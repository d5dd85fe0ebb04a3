package com.multiangle.orchestration.service;

import com.multiangle.orchestration.model.NormalizedResponse;
import com.multiangle.orchestration.model.Source;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges citations across responses. The first occurrence of a {@code sourceId} wins, later duplicates are dropped
 * whatever their other fields hold. Sources without an id have no identity and are skipped.
 */
@Service
public class SourceDeduplicator {

    public List<Source> deduplicate(List<NormalizedResponse> responses) {
        List<Source> all = new ArrayList<>();
        for (NormalizedResponse response : responses) {
            if (response.sources() != null) {
                all.addAll(response.sources());
            }
        }
        return deduplicateSources(all);
    }

    public List<Source> deduplicateSources(List<Source> sources) {
        Set<String> seen = new HashSet<>();
        List<Source> unique = new ArrayList<>();
        for (Source source : sources) {
            if (source == null || !StringUtils.hasText(source.sourceId())) {
                continue;
            }
            if (seen.add(source.sourceId())) {
                unique.add(source);
            }
        }
        return List.copyOf(unique);
    }
}
