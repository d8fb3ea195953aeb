package com.bko.controltower.api;

import static com.bko.controltower.orchestration.OrchestrationConstants.AGENT_SUPPLIER;
import static com.bko.controltower.orchestration.OrchestrationConstants.AGENT_VISION;

import com.bko.controltower.a2a.AgentClient;
import com.bko.controltower.a2a.AgentDiscoveryException;
import com.bko.controltower.config.ControlTowerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Reports which downstream agents are currently discoverable.
 */
@RestController
@RequestMapping("/api/agents")
@Slf4j
public class AgentController {

    private final AgentClient agentClient;
    private final ControlTowerProperties properties;

    public AgentController(AgentClient agentClient, ControlTowerProperties properties) {
        this.agentClient = agentClient;
        this.properties = properties;
    }

    @GetMapping
    public List<AgentStatusResponse> agents() {
        return List.of(
                status(AGENT_VISION, properties.getVision().getUrl()),
                status(AGENT_SUPPLIER, properties.getSupplier().getUrl()));
    }

    private AgentStatusResponse status(String agent, String url) {
        try {
            return AgentStatusResponse.available(agent, url, agentClient.discover(url));
        } catch (AgentDiscoveryException ex) {
            log.info("Agent '{}' at {} is not discoverable: {}", agent, url, ex.getMessage());
            return AgentStatusResponse.unavailable(agent, url, ex.getMessage());
        }
    }
}
