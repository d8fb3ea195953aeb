package com.bko.controltower.orchestration.service;

import com.bko.controltower.ControlTowerException;

/**
 * Agent text was present but not in the expected structured shape. Never fatal to a run.
 */
public class ResponseParseException extends ControlTowerException {

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
