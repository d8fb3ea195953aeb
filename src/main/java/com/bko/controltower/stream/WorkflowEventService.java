package com.bko.controltower.stream;

import com.bko.controltower.a2a.AgentDescriptor;
import com.bko.controltower.orchestration.model.SupplierMatch;
import com.bko.controltower.orchestration.model.ThinkingStep;
import com.bko.controltower.orchestration.model.VisionAnalysis;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.bko.controltower.orchestration.OrchestrationConstants.*;

/**
 * Builds the observer-facing events for each workflow step and hands them to the broadcaster.
 */
@Component
public class WorkflowEventService {

    private final EventBroadcaster broadcaster;

    public WorkflowEventService(EventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    public void emitUploadComplete(String runId, int imageBytes) {
        publish(WorkflowEventType.UPLOAD_COMPLETE, Map.of(
                "message", UPLOAD_COMPLETE_MESSAGE,
                "run_id", runId,
                "size_bytes", imageBytes
        ));
    }

    public void emitDiscoveryStart(String agent, String message) {
        publish(WorkflowEventType.DISCOVERY_START, Map.of(
                "agent", agent,
                "message", message
        ));
    }

    public void emitDiscoveryComplete(String agent, String label, AgentDescriptor descriptor) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent", agent);
        payload.put("message", label + " discovered: " + descriptor.name());
        payload.put("name", descriptor.name());
        payload.put("version", nullToEmpty(descriptor.version()));
        payload.put("skills", descriptor.skills().stream().map(skill -> nullToEmpty(skill.id())).toList());
        publish(WorkflowEventType.DISCOVERY_COMPLETE, payload);
    }

    public void emitVisionStart() {
        publish(WorkflowEventType.VISION_START, Map.of(
                "message", VISION_START_MESSAGE,
                "details", VISION_START_DETAILS
        ));
    }

    public void emitVisionProgress(int step, int total, String message) {
        publish(WorkflowEventType.VISION_PROGRESS, Map.of(
                "step", step,
                "total", total,
                "message", message
        ));
    }

    public void emitVisionComplete(VisionAnalysis analysis) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", VISION_COMPLETE_MESSAGE);
        payload.put("result", analysis.text());
        payload.put("code_output", analysis.codeOutput());
        payload.put("search_query", analysis.searchQuery());
        payload.put("detections", analysis.detections());
        payload.put("item_count", analysis.detections().size());
        publish(WorkflowEventType.VISION_COMPLETE, payload);
    }

    public void emitVisionError(String error) {
        publish(WorkflowEventType.VISION_ERROR, Map.of(
                "message", "Vision Agent error: " + error,
                "error", error
        ));
    }

    public void emitMemoryStart(String query) {
        publish(WorkflowEventType.MEMORY_START, Map.of(
                "message", MEMORY_START_MESSAGE,
                "details", "Search query: " + query,
                "query", query
        ));
    }

    public void emitMemoryComplete(SupplierMatch match) {
        publish(WorkflowEventType.MEMORY_COMPLETE, Map.of(
                "message", "Match found: " + match.part(),
                "part", match.part(),
                "supplier", match.supplier(),
                "confidence", match.confidence()
        ));
    }

    public void emitMemoryCompleteRaw(String rawResult) {
        publish(WorkflowEventType.MEMORY_COMPLETE, Map.of(
                "message", MEMORY_RAW_MESSAGE,
                "result", rawResult
        ));
    }

    public void emitMemoryError(String message, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        if (error != null) {
            payload.put("error", error);
        }
        publish(WorkflowEventType.MEMORY_ERROR, payload);
    }

    public void emitOrderPlaced(String orderId, SupplierMatch match) {
        publish(WorkflowEventType.ORDER_PLACED, Map.of(
                "message", "Order " + orderId + " placed autonomously",
                "order_id", orderId,
                "part", match.part(),
                "supplier", match.supplier()
        ));
    }

    public void emitThinking(String agent, List<ThinkingStep> steps) {
        if (steps.isEmpty()) {
            return;
        }
        publish(WorkflowEventType.THINKING_UPDATE, Map.of(
                "agent", agent,
                "steps", steps
        ));
    }

    public void emitWorkflowError(String runId, String error) {
        publish(WorkflowEventType.WORKFLOW_ERROR, Map.of(
                "message", "Workflow stopped unexpectedly: " + error,
                "run_id", runId,
                "error", error
        ));
    }

    private void publish(WorkflowEventType type, Map<String, Object> payload) {
        broadcaster.publish(WorkflowEvent.of(type, payload));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
