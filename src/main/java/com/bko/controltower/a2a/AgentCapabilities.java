package com.bko.controltower.a2a;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentCapabilities(
        boolean streaming,
        boolean pushNotifications
) {
    public static AgentCapabilities none() {
        return new AgentCapabilities(false, false);
    }
}
