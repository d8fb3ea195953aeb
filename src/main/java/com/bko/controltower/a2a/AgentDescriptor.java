package com.bko.controltower.a2a;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Capability document returned by an agent during discovery. {@code baseUrl} is the address the
 * descriptor was fetched from; {@code url} is the task endpoint the agent advertises.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDescriptor(
        String name,
        String description,
        String baseUrl,
        String url,
        String version,
        List<String> defaultInputModes,
        List<String> defaultOutputModes,
        AgentCapabilities capabilities,
        List<AgentSkill> skills
) {
    public AgentDescriptor {
        defaultInputModes = defaultInputModes == null ? List.of() : List.copyOf(defaultInputModes);
        defaultOutputModes = defaultOutputModes == null ? List.of() : List.copyOf(defaultOutputModes);
        capabilities = capabilities == null ? AgentCapabilities.none() : capabilities;
        skills = skills == null ? List.of() : List.copyOf(skills);
    }

    public AgentDescriptor withBaseUrl(String baseUrl) {
        return new AgentDescriptor(name, description, baseUrl, url, version,
                defaultInputModes, defaultOutputModes, capabilities, skills);
    }

    /**
     * Where task requests go. Falls back to the discovery address when the card has no url.
     */
    public String endpoint() {
        return StringUtils.hasText(url) ? url : baseUrl;
    }
}
