package com.bko.controltower.a2a;

import java.time.Duration;

/**
 * The only component that talks to remote agents.
 */
public interface AgentClient {

    /**
     * Fetches the capability descriptor published under the agent's base URL.
     *
     * @param baseUrl The agent's base URL.
     * @return The descriptor, with {@link AgentDescriptor#baseUrl()} set to {@code baseUrl}.
     * @throws AgentDiscoveryException if the agent is unreachable or the descriptor is malformed.
     */
    AgentDescriptor discover(String baseUrl);

    /**
     * Sends one task request and waits for the reply. There is no retry.
     *
     * @param descriptor The descriptor returned by {@link #discover(String)}.
     * @param request A request built for this call only.
     * @param timeout Upper bound on waiting for the reply.
     * @return The reply reduced to its envelope shapes.
     * @throws AgentCallException on timeout, transport failure, or a protocol error reply.
     */
    TaskResponse send(AgentDescriptor descriptor, TaskRequest request, Duration timeout);
}
