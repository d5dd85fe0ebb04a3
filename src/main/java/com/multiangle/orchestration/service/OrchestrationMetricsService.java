package com.multiangle.orchestration.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class OrchestrationMetricsService {

    private final AtomicLong llmRequestCount = new AtomicLong();
    private final AtomicLong queryCount = new AtomicLong();
    private final AtomicLong angleCount = new AtomicLong();
    private final AtomicLong pollCount = new AtomicLong();
    private final AtomicLong branchSuccessCount = new AtomicLong();
    private final AtomicLong branchFailureCount = new AtomicLong();

    public void recordLlmRequest(String purpose) {
        long count = llmRequestCount.incrementAndGet();
        log.info("LLM request #{} sent (purpose={}).", count, purpose);
    }

    public void recordQuery() {
        queryCount.incrementAndGet();
    }

    public void recordAnglesGenerated(int generated) {
        if (generated <= 0) {
            return;
        }
        long total = angleCount.addAndGet(generated);
        log.info("Generated {} angles. Total angles so far={}.", generated, total);
    }

    public void recordPoll() {
        pollCount.incrementAndGet();
    }

    public void recordBranchOutcome(boolean success) {
        if (success) {
            branchSuccessCount.incrementAndGet();
        } else {
            branchFailureCount.incrementAndGet();
        }
    }

    public long llmRequests() {
        return llmRequestCount.get();
    }

    public long polls() {
        return pollCount.get();
    }

    public long branchFailures() {
        return branchFailureCount.get();
    }

    public void logSummary() {
        log.info("Orchestration stats: totalQueries={}, totalLlmRequests={}, totalAngles={}, totalPolls={}, "
                        + "branchSuccesses={}, branchFailures={}.",
                queryCount.get(), llmRequestCount.get(), angleCount.get(), pollCount.get(),
                branchSuccessCount.get(), branchFailureCount.get());
    }
}
