package com.bko.controltower.a2a;

import java.util.List;
import java.util.UUID;

/**
 * A single message sent to an agent. Build a new one for every call.
 */
public record TaskRequest(
        String id,
        String role,
        List<ContentPart> parts,
        String messageId
) {
    public static final String ROLE_USER = "user";

    public TaskRequest {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public static TaskRequest fromUser(List<ContentPart> parts) {
        return new TaskRequest(UUID.randomUUID().toString(), ROLE_USER, parts,
                UUID.randomUUID().toString().replace("-", ""));
    }
}
