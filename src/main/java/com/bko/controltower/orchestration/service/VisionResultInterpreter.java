package com.bko.controltower.orchestration.service;

import static com.bko.controltower.orchestration.OrchestrationConstants.*;

import com.bko.controltower.config.ControlTowerProperties;
import com.bko.controltower.orchestration.model.Detection;
import com.bko.controltower.orchestration.model.VisionAnalysis;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the two vision replies into a {@link VisionAnalysis}: the supplier search query, the
 * detected bounding boxes and any code output. Nothing here fails the run.
 */
@Service
@Slf4j
public class VisionResultInterpreter {

    private static final Pattern SEARCH_TERMS = Pattern.compile(
            "^\\s*" + Pattern.quote(SEARCH_TERMS_PREFIX) + "\\s*(.+?)\\s*$",
            Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);
    private static final TypeReference<List<Detection>> DETECTIONS = new TypeReference<>() {};

    private final JsonProcessingService jsonProcessingService;
    private final ControlTowerProperties properties;

    public VisionResultInterpreter(JsonProcessingService jsonProcessingService, ControlTowerProperties properties) {
        this.jsonProcessingService = jsonProcessingService;
        this.properties = properties;
    }

    public VisionAnalysis interpret(String analysisText, @Nullable String detectionText) {
        String text = analysisText == null ? "" : analysisText;
        return new VisionAnalysis(text, codeOutput(text), searchQuery(text), detections(text, detectionText));
    }

    /**
     * Prefers the agent's own "Search terms:" line. Otherwise the first characters of the raw
     * analysis are used as-is, which is a heuristic with no quality guarantee.
     */
    public String searchQuery(String analysisText) {
        int maxLength = Math.max(1, properties.getSearchQueryMaxLength());
        if (!StringUtils.hasText(analysisText)) {
            return DEFAULT_SEARCH_QUERY;
        }
        Matcher matcher = SEARCH_TERMS.matcher(analysisText);
        if (matcher.find() && StringUtils.hasText(matcher.group(1))) {
            return prefix(matcher.group(1).trim(), maxLength);
        }
        log.info("Vision result has no search terms; using the first {} characters as the query.", maxLength);
        return prefix(analysisText, maxLength).trim();
    }

    @Nullable
    String codeOutput(String analysisText) {
        if (analysisText.contains(CODE_OUTPUT_MARKER) || analysisText.toLowerCase(Locale.ROOT).contains("result")) {
            return analysisText;
        }
        return null;
    }

    List<Detection> detections(String analysisText, @Nullable String detectionText) {
        if (StringUtils.hasText(detectionText)) {
            try {
                return parseDetections(detectionText);
            } catch (ResponseParseException ex) {
                log.warn("Detection reply not usable, falling back to analysis text: {}", ex.getMessage());
            }
        }
        String tagged = taggedBlock(analysisText);
        if (tagged == null) {
            return List.of();
        }
        try {
            return parseDetections(tagged);
        } catch (ResponseParseException ex) {
            log.warn("Bounding boxes in analysis text not usable: {}", ex.getMessage());
            return List.of();
        }
    }

    private List<Detection> parseDetections(String text) {
        String tagged = taggedBlock(text);
        List<Detection> detections = jsonProcessingService.parseJsonArray("detection",
                tagged != null ? tagged : text, DETECTIONS);
        if (detections == null) {
            return List.of();
        }
        return detections.stream()
                .filter(detection -> detection != null && detection.box2d().size() == 4)
                .toList();
    }

    @Nullable
    private String taggedBlock(String text) {
        int start = text.indexOf(BOUNDING_BOXES_START);
        if (start < 0) {
            return null;
        }
        int from = start + BOUNDING_BOXES_START.length();
        int end = text.indexOf(BOUNDING_BOXES_END, from);
        return end < 0 ? text.substring(from) : text.substring(from, end);
    }

    private static String prefix(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
