package com.bko.controltower.a2a;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * Extracts the text of an agent reply. Strategies are tried in order and the first one that yields
 * text wins. Support for a new reply shape is a new strategy at the end of the list.
 */
@Slf4j
@Component
public class ResponseNormalizer {

    @FunctionalInterface
    public interface ExtractionStrategy {
        Optional<String> extract(TaskResponse response);
    }

    static final ExtractionStrategy RESULT_MESSAGE = response -> response
            .envelope(ResponseEnvelope.ResultMessage.class)
            .map(envelope -> concat(envelope.parts()))
            .filter(StringUtils::hasLength);

    static final ExtractionStrategy ARTIFACT = response -> response
            .envelope(ResponseEnvelope.Artifact.class)
            .map(envelope -> concat(envelope.parts()))
            .filter(StringUtils::hasLength);

    static final ExtractionStrategy MESSAGES = response -> response
            .envelope(ResponseEnvelope.Messages.class)
            .map(envelope -> concatAll(envelope.messageParts()))
            .filter(StringUtils::hasLength);

    static final ExtractionStrategy RESULT_TASK = response -> response
            .envelope(ResponseEnvelope.ResultTask.class)
            .map(envelope -> {
                String artifacts = concatAll(envelope.artifactParts());
                return StringUtils.hasLength(artifacts) ? artifacts : concat(envelope.statusParts());
            })
            .filter(StringUtils::hasLength);

    private final List<ExtractionStrategy> strategies;

    public ResponseNormalizer() {
        this(List.of(RESULT_MESSAGE, ARTIFACT, MESSAGES, RESULT_TASK));
    }

    ResponseNormalizer(List<ExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public String normalize(TaskResponse response) {
        for (ExtractionStrategy strategy : strategies) {
            Optional<String> text = strategy.extract(response);
            if (text.isPresent()) {
                return text.get();
            }
        }
        log.warn("No text found in agent response {} (shapes={}).", response.requestId(), shapeNames(response));
        return "";
    }

    private static String concat(List<ResponsePart> parts) {
        StringBuilder text = new StringBuilder();
        for (ResponsePart part : parts) {
            String value = part.resolvedText();
            if (value != null) {
                text.append(value);
            }
        }
        return text.toString();
    }

    private static String concatAll(List<List<ResponsePart>> partLists) {
        StringBuilder text = new StringBuilder();
        partLists.forEach(parts -> text.append(concat(parts)));
        return text.toString();
    }

    private static List<String> shapeNames(TaskResponse response) {
        return response.envelopes().stream()
                .map(envelope -> envelope.getClass().getSimpleName())
                .toList();
    }
}
