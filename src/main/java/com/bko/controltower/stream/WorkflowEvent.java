package com.bko.controltower.stream;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One message for observers. Serialized flat: {@code type}, the payload keys, then {@code timestamp}.
 */
public record WorkflowEvent(
        WorkflowEventType type,
        Map<String, Object> payload,
        Instant timestamp
) {
    public WorkflowEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static WorkflowEvent of(WorkflowEventType type, Map<String, Object> payload) {
        return new WorkflowEvent(type, payload, Instant.now());
    }

    public Map<String, Object> toWireMessage() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type.wireName());
        payload.forEach(message::putIfAbsent);
        message.put("timestamp", timestamp.toEpochMilli());
        return message;
    }
}
