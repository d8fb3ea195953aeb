package com.bko.controltower.orchestration;

import com.bko.controltower.orchestration.model.WorkflowPhase;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks the current phase of one workflow run. Confined to the thread executing the run.
 */
@Slf4j
final class WorkflowRun {

    private final String id;
    private final long startedAt = System.nanoTime();
    private WorkflowPhase phase = WorkflowPhase.UPLOAD_RECEIVED;

    WorkflowRun(String id) {
        this.id = id;
    }

    String id() {
        return id;
    }

    WorkflowPhase phase() {
        return phase;
    }

    void advance(WorkflowPhase next) {
        if (phase.isTerminal()) {
            log.debug("Run {} already ended in {}; ignoring {}.", id, phase, next);
            return;
        }
        log.debug("Run {}: {} -> {}", id, phase, next);
        phase = next;
    }

    long elapsedMillis() {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }
}
