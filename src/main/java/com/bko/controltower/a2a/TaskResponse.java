package com.bko.controltower.a2a;

import java.util.List;
import java.util.Optional;

/**
 * A reply from an agent, reduced to the envelope shapes found in it.
 */
public record TaskResponse(String requestId, List<ResponseEnvelope> envelopes) {

    public TaskResponse {
        envelopes = envelopes == null ? List.of() : List.copyOf(envelopes);
    }

    public static TaskResponse of(String requestId, ResponseEnvelope... envelopes) {
        return new TaskResponse(requestId, List.of(envelopes));
    }

    public <T extends ResponseEnvelope> Optional<T> envelope(Class<T> shape) {
        return envelopes.stream()
                .filter(shape::isInstance)
                .map(shape::cast)
                .findFirst();
    }
}
