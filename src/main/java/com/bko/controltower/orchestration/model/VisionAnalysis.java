package com.bko.controltower.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;

public record VisionAnalysis(
        String text,
        @Nullable String codeOutput,
        String searchQuery,
        List<Detection> detections
) {
    public VisionAnalysis {
        detections = detections == null ? List.of() : List.copyOf(detections);
    }
}
