package com.bko.controltower.api;

public record AnalyzeResponse(
        String status,
        String message
) {
    public static AnalyzeResponse processing() {
        return new AnalyzeResponse("processing", "Workflow started. Listen to WebSocket for real-time updates.");
    }
}
