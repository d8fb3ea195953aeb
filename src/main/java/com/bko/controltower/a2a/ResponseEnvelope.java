package com.bko.controltower.a2a;

import java.util.List;

/**
 * The closed set of response shapes the control tower understands. A reply may match more than one.
 */
public sealed interface ResponseEnvelope
        permits ResponseEnvelope.ResultMessage, ResponseEnvelope.ResultTask,
        ResponseEnvelope.Artifact, ResponseEnvelope.Messages {

    /** {@code result.parts[]}: a message returned as the JSON-RPC result. */
    record ResultMessage(List<ResponsePart> parts) implements ResponseEnvelope {
        public ResultMessage {
            parts = List.copyOf(parts);
        }
    }

    /** {@code result.artifacts[].parts[]} and {@code result.status.message.parts[]}: a task result. */
    record ResultTask(List<List<ResponsePart>> artifactParts, List<ResponsePart> statusParts) implements ResponseEnvelope {
        public ResultTask {
            artifactParts = artifactParts.stream().map(List::copyOf).toList();
            statusParts = List.copyOf(statusParts);
        }
    }

    /** {@code artifact.parts[]}: legacy single-artifact reply. */
    record Artifact(List<ResponsePart> parts) implements ResponseEnvelope {
        public Artifact {
            parts = List.copyOf(parts);
        }
    }

    /** {@code messages[].parts[]}: legacy message-list reply. */
    record Messages(List<List<ResponsePart>> messageParts) implements ResponseEnvelope {
        public Messages {
            messageParts = messageParts.stream().map(List::copyOf).toList();
        }
    }
}
