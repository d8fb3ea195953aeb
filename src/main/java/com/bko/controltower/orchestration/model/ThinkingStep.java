package com.bko.controltower.orchestration.model;

public record ThinkingStep(
        int step,
        String thought,
        String timestamp
) {
}
