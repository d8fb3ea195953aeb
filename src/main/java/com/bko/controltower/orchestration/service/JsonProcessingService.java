package com.bko.controltower.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Pulls JSON out of free-form agent text. Agents often wrap JSON in prose or code fences.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private final ObjectMapper objectMapper;

    public <T> T parseJsonObject(String label, String raw, Class<T> type) {
        if (!StringUtils.hasText(raw)) {
            throw new ResponseParseException("Empty " + label + " response.");
        }
        String json = extract(raw, '{', '}');
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new ResponseParseException("Failed to parse " + label + " response as JSON. Snippet: "
                    + truncate(raw, 240), ex);
        }
    }

    public <T> T parseJsonArray(String label, String raw, TypeReference<T> type) {
        if (!StringUtils.hasText(raw)) {
            throw new ResponseParseException("Empty " + label + " response.");
        }
        String json = extract(raw, '[', ']');
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new ResponseParseException("Failed to parse " + label + " response as a JSON array. Snippet: "
                    + truncate(raw, 240), ex);
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), ex);
        }
    }

    private String extract(String raw, char open, char close) {
        String trimmed = raw.trim();
        if (!trimmed.isEmpty() && trimmed.charAt(0) == open && trimmed.charAt(trimmed.length() - 1) == close) {
            return trimmed;
        }
        int first = trimmed.indexOf(open);
        int last = trimmed.lastIndexOf(close);
        if (first >= 0 && last > first) {
            return trimmed.substring(first, last + 1);
        }
        return trimmed;
    }

    static String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }
}
