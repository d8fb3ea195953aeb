package com.bko.controltower;

/**
 * Base type for failures raised inside the control tower.
 */
public class ControlTowerException extends RuntimeException {

    public ControlTowerException(String message) {
        super(message);
    }

    public ControlTowerException(String message, Throwable cause) {
        super(message, cause);
    }
}
