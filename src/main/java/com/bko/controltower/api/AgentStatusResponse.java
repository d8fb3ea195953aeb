package com.bko.controltower.api;

import com.bko.controltower.a2a.AgentDescriptor;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentStatusResponse(
        String agent,
        String url,
        boolean available,
        AgentDescriptor descriptor,
        String error
) {
    public static AgentStatusResponse available(String agent, String url, AgentDescriptor descriptor) {
        return new AgentStatusResponse(agent, url, true, descriptor, null);
    }

    public static AgentStatusResponse unavailable(String agent, String url, String error) {
        return new AgentStatusResponse(agent, url, false, null, error);
    }
}
