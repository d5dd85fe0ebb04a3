package com.multiangle.orchestration.service;

import static com.multiangle.orchestration.OrchestrationConstants.BRANCH_EXCEPTION_MESSAGE;
import com.multiangle.orchestration.model.AngleResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

/**
 * Resolves every angle concurrently and waits for all of them. Returns exactly one result per angle, in submission
 * order. A failing branch never cancels or delays its siblings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FanOutCoordinator {

    private final AngleResolver angleResolver;

    public List<AngleResult> resolveAll(String query, List<String> angles) {
        if (angles == null || angles.isEmpty()) {
            return List.of();
        }
        log.info("Resolving {} angles for query: {}", angles.size(), query);
        AngleResult[] slots = new AngleResult[angles.size()];
        CompletableFuture<?>[] branches = IntStream.range(0, angles.size())
                .mapToObj(index -> launch(angles.get(index))
                        .thenAccept(result -> slots[index] = result))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(branches).join();
        long failures = Arrays.stream(slots).filter(result -> !result.isSuccess()).count();
        log.info("Received {} angle results ({} failed).", slots.length, failures);
        return List.of(slots);
    }

    private CompletableFuture<AngleResult> launch(String angle) {
        CompletableFuture<AngleResult> branch;
        try {
            branch = angleResolver.resolve(angle);
        } catch (RuntimeException ex) {
            branch = CompletableFuture.failedFuture(ex);
        }
        if (branch == null) {
            branch = CompletableFuture.failedFuture(new IllegalStateException("Resolver returned no result"));
        }
        return branch.handle((result, ex) -> {
            if (ex != null || result == null) {
                Throwable cause = ex != null ? AngleResolver.unwrap(ex) : new IllegalStateException("Resolver returned no result");
                log.warn("Branch for angle '{}' raised: {}", angle, cause.getMessage());
                return AngleResult.failure(angle, BRANCH_EXCEPTION_MESSAGE.formatted(angle, cause.getMessage()));
            }
            return result;
        });
    }
}
