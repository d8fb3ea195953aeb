package com.bko.controltower.orchestration.model;

public enum WorkflowPhase {
    UPLOAD_RECEIVED,
    VISION_DISCOVERY,
    VISION_ANALYSIS,
    SUPPLIER_DISCOVERY,
    SUPPLIER_SEARCH,
    ACTION_TAKEN,
    FAILED;

    public boolean isTerminal() {
        return this == ACTION_TAKEN || this == FAILED;
    }
}
