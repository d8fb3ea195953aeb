package com.bko.controltower.a2a;

import com.bko.controltower.ControlTowerException;

/**
 * A task call timed out, failed in transport, or was answered with a protocol error.
 */
public class AgentCallException extends ControlTowerException {

    public AgentCallException(String message) {
        super(message);
    }

    public AgentCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
