package com.multiangle.orchestration.service;

import static com.multiangle.orchestration.OrchestrationConstants.*;
import com.multiangle.config.MultiAngleProperties;
import com.multiangle.orchestration.api.AssistantService;
import com.multiangle.orchestration.model.AngleResult;
import com.multiangle.orchestration.model.AssistantMessage;
import com.multiangle.orchestration.model.ConversationHandle;
import com.multiangle.orchestration.model.MessageState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Resolves one angle against the assistant service: create a conversation, then poll the answer message until it
 * reaches a terminal state or the attempt budget runs out.
 *
 * <p>The returned future always completes normally. Every failure is captured into {@link AngleResult#error()}.
 * Waits between polls are scheduled through {@link CompletableFuture#delayedExecutor}, so a waiting branch does not
 * occupy a thread.
 */
@Service
@Slf4j
public class AngleResolver {

    private final AssistantService assistantService;
    private final ExecutorService angleExecutor;
    private final OrchestrationMetricsService metricsService;
    private final Duration pollInterval;
    private final int maxAttempts;

    public AngleResolver(AssistantService assistantService,
                         @Qualifier("angleExecutor") ExecutorService angleExecutor,
                         OrchestrationMetricsService metricsService,
                         MultiAngleProperties properties) {
        this.assistantService = assistantService;
        this.angleExecutor = angleExecutor;
        this.metricsService = metricsService;
        this.pollInterval = properties.getPolling().getInterval();
        this.maxAttempts = properties.getPolling().getMaxAttempts();
    }

    public CompletableFuture<AngleResult> resolve(String angle) {
        log.info("Processing angle: {}", angle);
        return CompletableFuture.supplyAsync(() -> assistantService.createConversation(angle), angleExecutor)
                .thenCompose(handle -> afterCreation(angle, handle))
                .exceptionally(ex -> {
                    Throwable cause = unwrap(ex);
                    log.warn("Angle '{}' failed: {}", angle, cause.getMessage());
                    return AngleResult.failure(angle, BRANCH_EXCEPTION_MESSAGE.formatted(angle, cause.getMessage()));
                })
                .whenComplete((result, ex) -> metricsService.recordBranchOutcome(result != null && result.isSuccess()));
    }

    /**
     * Polls a message until it is terminal or the attempt budget is spent. On exhaustion the last fetched message is
     * returned even though it is not terminal; a transport error on the final attempt completes the future
     * exceptionally.
     */
    public CompletableFuture<AssistantMessage> pollMessage(ConversationHandle handle) {
        return poll(handle, 1, null, angleExecutor);
    }

    private CompletableFuture<AngleResult> afterCreation(String angle, @Nullable ConversationHandle handle) {
        if (handle == null || !StringUtils.hasText(handle.conversationId())) {
            log.warn("Failed to create conversation for angle '{}'. Response: {}", angle, handle);
            return CompletableFuture.completedFuture(AngleResult.failure(angle, ERROR_CREATE_CONVERSATION_FAILED));
        }
        if (!StringUtils.hasText(handle.messageId())) {
            log.warn("No message id for angle '{}'. Response: {}", angle, handle);
            return CompletableFuture.completedFuture(AngleResult.failure(angle, ERROR_NO_MESSAGE_ID));
        }
        return pollMessage(handle).thenApply(message -> toResult(angle, handle, message));
    }

    private AngleResult toResult(String angle, ConversationHandle handle, AssistantMessage message) {
        if (message.state() == MessageState.FAILED) {
            String remoteError = StringUtils.hasText(message.error()) ? message.error() : message.status();
            log.warn("Assistant reported failure for angle '{}': {}", angle, remoteError);
            return AngleResult.failure(angle, ERROR_MESSAGE_FAILED + ": " + remoteError);
        }
        log.info("Message data retrieved for angle '{}' (state={}).", angle, message.state());
        return AngleResult.success(angle, handle, message);
    }

    private CompletableFuture<AssistantMessage> poll(ConversationHandle handle, int attempt,
                                                     @Nullable AssistantMessage previous, Executor executor) {
        return CompletableFuture
                .supplyAsync(() -> fetch(handle), executor)
                .handle((message, ex) -> {
                    if (ex != null) {
                        Throwable cause = unwrap(ex);
                        if (attempt >= maxAttempts) {
                            return CompletableFuture.<AssistantMessage>failedFuture(cause);
                        }
                        log.warn("Poll attempt {}/{} for message {} failed: {}. Retrying.",
                                attempt, maxAttempts, handle.messageId(), cause.getMessage());
                        return poll(handle, attempt + 1, previous, delayed());
                    }
                    MessageState state = message.state();
                    if (state.regressesFrom(previous != null ? previous.state() : null)) {
                        log.debug("Message {} moved backwards from {} to {}.", handle.messageId(), previous.state(), state);
                    }
                    if (state.isTerminal()) {
                        return CompletableFuture.completedFuture(message);
                    }
                    if (attempt >= maxAttempts) {
                        log.warn("Message {} still {} after {} attempts. Returning last fetched state.",
                                handle.messageId(), state, attempt);
                        return CompletableFuture.completedFuture(message);
                    }
                    return poll(handle, attempt + 1, message, delayed());
                })
                .thenCompose(Function.identity());
    }

    private AssistantMessage fetch(ConversationHandle handle) {
        metricsService.recordPoll();
        AssistantMessage message = assistantService.getMessage(handle.conversationId(), handle.messageId());
        if (message == null) {
            throw new IllegalStateException("Empty response fetching message " + handle.messageId());
        }
        return message;
    }

    private Executor delayed() {
        return CompletableFuture.delayedExecutor(pollInterval.toMillis(), TimeUnit.MILLISECONDS, angleExecutor);
    }

    static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
