package com.bko.controltower.orchestration;

import static com.bko.controltower.orchestration.OrchestrationConstants.*;

import com.bko.controltower.ControlTowerException;
import com.bko.controltower.a2a.AgentCallException;
import com.bko.controltower.a2a.AgentClient;
import com.bko.controltower.a2a.AgentDescriptor;
import com.bko.controltower.a2a.ContentPart;
import com.bko.controltower.a2a.ResponseNormalizer;
import com.bko.controltower.a2a.TaskRequest;
import com.bko.controltower.config.ControlTowerProperties;
import com.bko.controltower.orchestration.model.SupplierMatch;
import com.bko.controltower.orchestration.model.VisionAnalysis;
import com.bko.controltower.orchestration.model.WorkflowPhase;
import com.bko.controltower.orchestration.service.JsonProcessingService;
import com.bko.controltower.orchestration.service.ResponseParseException;
import com.bko.controltower.orchestration.service.SupplierMatchParser;
import com.bko.controltower.orchestration.service.ThinkingStepExtractor;
import com.bko.controltower.orchestration.service.VisionProgressReporter;
import com.bko.controltower.orchestration.service.VisionResultInterpreter;
import com.bko.controltower.orchestration.service.WorkflowMetricsService;
import com.bko.controltower.payload.ImagePayloadPreparer;
import com.bko.controltower.payload.PreparedImage;
import com.bko.controltower.stream.WorkflowEventService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one upload through vision discovery, vision analysis, supplier discovery, supplier search
 * and the order action. Each phase either advances or publishes its error event and ends the run;
 * no phase failure escapes {@link #run(String, byte[])}.
 */
@Service
@Slf4j
public class WorkflowOrchestrator {

    private static final Duration TIMEOUT_GRACE = Duration.ofSeconds(5);

    private final AgentClient agentClient;
    private final ImagePayloadPreparer payloadPreparer;
    private final ResponseNormalizer responseNormalizer;
    private final VisionResultInterpreter visionResultInterpreter;
    private final SupplierMatchParser supplierMatchParser;
    private final ThinkingStepExtractor thinkingStepExtractor;
    private final JsonProcessingService jsonProcessingService;
    private final VisionProgressReporter progressReporter;
    private final WorkflowEventService events;
    private final WorkflowMetricsService metricsService;
    private final ControlTowerProperties properties;
    private final ExecutorService agentCallExecutor;

    public WorkflowOrchestrator(AgentClient agentClient,
                                ImagePayloadPreparer payloadPreparer,
                                ResponseNormalizer responseNormalizer,
                                VisionResultInterpreter visionResultInterpreter,
                                SupplierMatchParser supplierMatchParser,
                                ThinkingStepExtractor thinkingStepExtractor,
                                JsonProcessingService jsonProcessingService,
                                VisionProgressReporter progressReporter,
                                WorkflowEventService events,
                                WorkflowMetricsService metricsService,
                                ControlTowerProperties properties,
                                @Qualifier("agentCallExecutor") ExecutorService agentCallExecutor) {
        this.agentClient = agentClient;
        this.payloadPreparer = payloadPreparer;
        this.responseNormalizer = responseNormalizer;
        this.visionResultInterpreter = visionResultInterpreter;
        this.supplierMatchParser = supplierMatchParser;
        this.thinkingStepExtractor = thinkingStepExtractor;
        this.jsonProcessingService = jsonProcessingService;
        this.progressReporter = progressReporter;
        this.events = events;
        this.metricsService = metricsService;
        this.properties = properties;
        this.agentCallExecutor = agentCallExecutor;
    }

    /**
     * Runs the whole workflow for one uploaded image on the calling thread.
     *
     * @return {@link WorkflowPhase#ACTION_TAKEN} when the search phase produced a result,
     *         {@link WorkflowPhase#FAILED} when a phase published an error event
     */
    public WorkflowPhase run(String runId, byte[] imageBytes) {
        WorkflowRun run = new WorkflowRun(runId);
        metricsService.recordRunStarted(runId, imageBytes.length);
        events.emitUploadComplete(runId, imageBytes.length);
        pause();

        VisionAnalysis analysis = visionPhases(run, imageBytes);
        if (analysis != null) {
            pause();
            supplierPhases(run, analysis);
        }
        metricsService.recordRunFinished(runId, run.phase(), run.elapsedMillis());
        return run.phase();
    }

    private VisionAnalysis visionPhases(WorkflowRun run, byte[] imageBytes) {
        try {
            run.advance(WorkflowPhase.VISION_DISCOVERY);
            events.emitDiscoveryStart(AGENT_VISION, VISION_DISCOVERY_MESSAGE);
            AgentDescriptor vision = agentClient.discover(properties.getVision().getUrl());
            events.emitDiscoveryComplete(AGENT_VISION, "Vision Agent", vision);
            pause();

            run.advance(WorkflowPhase.VISION_ANALYSIS);
            events.emitVisionStart();
            PreparedImage image = payloadPreparer.prepare(imageBytes);
            VisionAnalysis analysis = analyzeImage(run, vision, image);
            events.emitVisionComplete(analysis);
            events.emitThinking(AGENT_VISION, thinkingStepExtractor.visionSteps(analysis.text()));
            return analysis;
        } catch (ControlTowerException ex) {
            log.warn("Run {} failed during {}: {}", run.id(), run.phase(), describe(ex));
            run.advance(WorkflowPhase.FAILED);
            events.emitVisionError(describe(ex));
            return null;
        }
    }

    private void supplierPhases(WorkflowRun run, VisionAnalysis analysis) {
        try {
            run.advance(WorkflowPhase.SUPPLIER_DISCOVERY);
            events.emitDiscoveryStart(AGENT_SUPPLIER, SUPPLIER_DISCOVERY_MESSAGE);
            AgentDescriptor supplier = agentClient.discover(properties.getSupplier().getUrl());
            events.emitDiscoveryComplete(AGENT_SUPPLIER, "Supplier Agent", supplier);
            pause();

            run.advance(WorkflowPhase.SUPPLIER_SEARCH);
            String query = analysis.searchQuery();
            events.emitMemoryStart(query);
            String resultText = call(run, supplier, "search", supplierRequest(query)).join();
            if (!StringUtils.hasText(resultText)) {
                run.advance(WorkflowPhase.FAILED);
                events.emitMemoryError(NO_SUPPLIER_MESSAGE, null);
                return;
            }
            SupplierMatch match;
            try {
                match = supplierMatchParser.parse(resultText);
            } catch (ResponseParseException ex) {
                log.warn("Run {}: supplier result is not a structured match, reporting raw text. {}", run.id(), ex.getMessage());
                events.emitMemoryCompleteRaw(resultText);
                run.advance(WorkflowPhase.ACTION_TAKEN);
                return;
            }
            events.emitMemoryComplete(match);
            events.emitThinking(AGENT_MEMORY, thinkingStepExtractor.supplierSteps());
            pause();

            String orderId = "#" + ThreadLocalRandom.current().nextInt(ORDER_ID_MIN, ORDER_ID_MAX + 1);
            run.advance(WorkflowPhase.ACTION_TAKEN);
            events.emitOrderPlaced(orderId, match);
            log.info("Run {}: order {} placed for '{}' from '{}'.", run.id(), orderId, match.part(), match.supplier());
        } catch (CompletionException ex) {
            failSupplier(run, unwrap(ex));
        } catch (ControlTowerException ex) {
            failSupplier(run, ex);
        }
    }

    private void failSupplier(WorkflowRun run, ControlTowerException ex) {
        log.warn("Run {} failed during {}: {}", run.id(), run.phase(), describe(ex));
        run.advance(WorkflowPhase.FAILED);
        events.emitMemoryError("Supplier Agent error: " + describe(ex), describe(ex));
    }

    /**
     * Issues the analysis and the detection call at the same time and waits for both. Progress
     * events run only until the analysis call resolves. Either call failing fails the phase as
     * soon as the failure is seen.
     * <p>
     * Cancelling the sibling call stops the wait, not the HTTP exchange: a blocking socket read is not
     * interruptible, so the sibling keeps its {@code agent-call-} thread until the agent answers or
     * {@code callTimeout} expires.
     */
    private VisionAnalysis analyzeImage(WorkflowRun run, AgentDescriptor vision, PreparedImage image) {
        VisionProgressReporter.Ticker progress = progressReporter.start();
        CompletableFuture<String> analysis = null;
        CompletableFuture<String> detection = null;
        try {
            analysis = call(run, vision, "analyze", visionRequest(image, ANALYSIS_QUERY));
            analysis.whenComplete((text, ex) -> progress.stop());
            detection = call(run, vision, "detect", visionRequest(image, DETECTION_QUERY));
            joinFailFast(analysis, detection);
            return visionResultInterpreter.interpret(analysis.join(), detection.join());
        } catch (CompletionException ex) {
            cancel(analysis);
            cancel(detection);
            throw unwrap(ex);
        } finally {
            progress.stop();
        }
    }

    private CompletableFuture<String> call(WorkflowRun run, AgentDescriptor agent, String purpose, TaskRequest request) {
        Duration timeout = properties.getCallTimeout();
        metricsService.recordAgentCall(run.id(), agent.name(), purpose);
        try {
            return CompletableFuture
                    .supplyAsync(() -> responseNormalizer.normalize(agentClient.send(agent, request, timeout)), agentCallExecutor)
                    .orTimeout(timeout.plus(TIMEOUT_GRACE).toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            return CompletableFuture.failedFuture(
                    new AgentCallException("Call to '" + agent.name() + "' was rejected: executor is shut down.", ex));
        }
    }

    private static void cancel(CompletableFuture<?> future) {
        if (future != null) {
            future.cancel(true);
        }
    }

    private static void joinFailFast(CompletableFuture<?> first, CompletableFuture<?> second) {
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        first.whenComplete((value, ex) -> {
            if (ex != null) {
                firstFailure.completeExceptionally(ex);
            }
        });
        second.whenComplete((value, ex) -> {
            if (ex != null) {
                firstFailure.completeExceptionally(ex);
            }
        });
        CompletableFuture.anyOf(CompletableFuture.allOf(first, second), firstFailure).join();
    }

    private TaskRequest visionRequest(PreparedImage image, String query) {
        if (properties.getImageTransport() == ControlTowerProperties.ImageTransport.FILE_PART) {
            return TaskRequest.fromUser(List.of(
                    ContentPart.file(image.bytes(), image.mimeType()),
                    ContentPart.text(query)));
        }
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("image_base64", Base64.getEncoder().encodeToString(image.bytes()));
        payload.put("query", query);
        return TaskRequest.fromUser(List.of(ContentPart.text(jsonProcessingService.toJson(payload))));
    }

    private TaskRequest supplierRequest(String query) {
        return TaskRequest.fromUser(List.of(ContentPart.text(jsonProcessingService.toJson(Map.of("query", query)))));
    }

    private void pause() {
        Duration pause = properties.getPhasePause();
        if (pause == null || pause.isZero() || pause.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static ControlTowerException unwrap(CompletionException ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof ControlTowerException controlTowerException) {
            return controlTowerException;
        }
        if (cause instanceof TimeoutException) {
            return new AgentCallException("Agent call timed out.", cause);
        }
        return new AgentCallException("Agent call failed: " + describe(cause), cause);
    }

    private static String describe(Throwable ex) {
        return StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
