package com.bko.controltower.orchestration.service;

import com.bko.controltower.orchestration.model.WorkflowPhase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class WorkflowMetricsService {

    private final AtomicLong runsStarted = new AtomicLong();
    private final AtomicLong runsCompleted = new AtomicLong();
    private final AtomicLong runsFailed = new AtomicLong();
    private final AtomicLong agentCalls = new AtomicLong();

    public void recordRunStarted(String runId, int imageBytes) {
        long count = runsStarted.incrementAndGet();
        log.info("Run {} started with a {} KB image. Total runs={}.", runId, imageBytes / 1024, count);
    }

    public void recordAgentCall(String runId, String agent, String purpose) {
        long count = agentCalls.incrementAndGet();
        log.info("Agent call #{} sent (run={}, agent={}, purpose={}).", count, runId, agent, purpose);
    }

    public void recordRunFinished(String runId, WorkflowPhase finalPhase, long elapsedMillis) {
        if (finalPhase == WorkflowPhase.FAILED) {
            runsFailed.incrementAndGet();
        } else {
            runsCompleted.incrementAndGet();
        }
        log.info("Run {} finished in {} ({} ms).", runId, finalPhase, elapsedMillis);
        logSummary();
    }

    public void logSummary() {
        log.info("Workflow stats: runsStarted={}, runsCompleted={}, runsFailed={}, agentCalls={}.",
                runsStarted.get(), runsCompleted.get(), runsFailed.get(), agentCalls.get());
    }

    public long runsFailed() {
        return runsFailed.get();
    }

    public long runsCompleted() {
        return runsCompleted.get();
    }
}
