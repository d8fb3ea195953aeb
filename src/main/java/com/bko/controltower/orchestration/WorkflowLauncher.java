package com.bko.controltower.orchestration;

import com.bko.controltower.orchestration.model.WorkflowPhase;
import com.bko.controltower.stream.WorkflowEventService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Starts workflow runs in the background so the upload request can return immediately.
 */
@Component
@Slf4j
public class WorkflowLauncher {

    private final WorkflowOrchestrator orchestrator;
    private final WorkflowEventService events;
    private final ExecutorService workflowExecutor;

    public WorkflowLauncher(WorkflowOrchestrator orchestrator,
                            WorkflowEventService events,
                            @Qualifier("workflowExecutor") ExecutorService workflowExecutor) {
        this.orchestrator = orchestrator;
        this.events = events;
        this.workflowExecutor = workflowExecutor;
    }

    public CompletableFuture<WorkflowPhase> launch(byte[] imageBytes) {
        String runId = UUID.randomUUID().toString();
        log.info("Launching run {} for a {} byte upload.", runId, imageBytes.length);
        CompletableFuture<WorkflowPhase> future = CompletableFuture
                .supplyAsync(() -> orchestrator.run(runId, imageBytes), workflowExecutor);
        future.whenComplete((phase, ex) -> {
            if (ex == null) {
                return;
            }
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            log.error("Run {} stopped unexpectedly.", runId, cause);
            String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            events.emitWorkflowError(runId, error);
        });
        return future;
    }
}
