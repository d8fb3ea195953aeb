package com.bko.controltower.a2a;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw JSON reply into a {@link TaskResponse}. This is the only place that probes the JSON
 * for fields; everything downstream works on {@link ResponseEnvelope} variants.
 */
@Component
public class TaskResponseReader {

    public TaskResponse read(String requestId, JsonNode body) {
        List<ResponseEnvelope> envelopes = new ArrayList<>();
        JsonNode result = body.path("result");
        if (result.isObject()) {
            if (result.path("parts").isArray()) {
                envelopes.add(new ResponseEnvelope.ResultMessage(readParts(result.path("parts"))));
            }
            if (result.path("artifacts").isArray() || result.path("status").path("message").isObject()) {
                List<List<ResponsePart>> artifactParts = new ArrayList<>();
                for (JsonNode artifact : result.path("artifacts")) {
                    artifactParts.add(readParts(artifact.path("parts")));
                }
                List<ResponsePart> statusParts = readParts(result.path("status").path("message").path("parts"));
                envelopes.add(new ResponseEnvelope.ResultTask(artifactParts, statusParts));
            }
        }
        JsonNode artifact = body.path("artifact");
        if (artifact.isObject()) {
            envelopes.add(new ResponseEnvelope.Artifact(readParts(artifact.path("parts"))));
        }
        JsonNode messages = body.path("messages");
        if (messages.isArray()) {
            List<List<ResponsePart>> messageParts = new ArrayList<>();
            for (JsonNode message : messages) {
                messageParts.add(readParts(message.path("parts")));
            }
            envelopes.add(new ResponseEnvelope.Messages(messageParts));
        }
        return new TaskResponse(requestId, envelopes);
    }

    private List<ResponsePart> readParts(JsonNode parts) {
        if (!parts.isArray()) {
            return List.of();
        }
        List<ResponsePart> result = new ArrayList<>(parts.size());
        for (JsonNode part : parts) {
            if (part.isObject()) {
                result.add(readPart(part, true));
            }
        }
        return result;
    }

    private ResponsePart readPart(JsonNode part, boolean allowWrapper) {
        JsonNode text = part.get("text");
        String value = text != null && text.isTextual() ? text.asText() : null;
        JsonNode root = part.get("root");
        ResponsePart wrapper = allowWrapper && root != null && root.isObject() ? readPart(root, false) : null;
        return new ResponsePart(value, wrapper);
    }
}
