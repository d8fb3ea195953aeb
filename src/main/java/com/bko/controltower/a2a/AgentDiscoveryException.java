package com.bko.controltower.a2a;

import com.bko.controltower.ControlTowerException;

/**
 * The agent could not be reached or returned an unusable descriptor.
 */
public class AgentDiscoveryException extends ControlTowerException {

    public AgentDiscoveryException(String message) {
        super(message);
    }

    public AgentDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
