package com.bko.controltower.stream;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkflowEventType {
    UPLOAD_COMPLETE("upload_complete"),
    DISCOVERY_START("discovery_start"),
    DISCOVERY_COMPLETE("discovery_complete"),
    VISION_START("vision_start"),
    VISION_PROGRESS("vision_progress"),
    VISION_COMPLETE("vision_complete"),
    VISION_ERROR("vision_error"),
    MEMORY_START("memory_start"),
    MEMORY_COMPLETE("memory_complete"),
    MEMORY_ERROR("memory_error"),
    ORDER_PLACED("order_placed"),
    THINKING_UPDATE("thinking_update"),
    WORKFLOW_ERROR("workflow_error"),
    PONG("pong");

    private final String wireName;

    WorkflowEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
