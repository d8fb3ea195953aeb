package com.bko.controltower.a2a;

import com.bko.controltower.config.ControlTowerProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * {@link AgentClient} speaking the A2A JSON-RPC binding over HTTP.
 */
@Service
@Slf4j
public class A2AAgentClient implements AgentClient {

    static final String METHOD_MESSAGE_SEND = "message/send";
    static final String JSON_RPC_VERSION = "2.0";
    static final String MESSAGE_KIND = "message";

    // Typed records keep the declared ContentPart element type, so each part carries its "kind" tag.
    record JsonRpcRequest(String jsonrpc, String id, String method, MessageParams params) {
    }

    record MessageParams(OutboundMessage message) {
    }

    record OutboundMessage(String kind, String role, List<ContentPart> parts, String messageId) {
    }

    private final RestClient.Builder restClientBuilder;
    private final ObjectMapper objectMapper;
    private final TaskResponseReader responseReader;
    private final ControlTowerProperties properties;

    public A2AAgentClient(RestClient.Builder restClientBuilder,
                          ObjectMapper objectMapper,
                          TaskResponseReader responseReader,
                          ControlTowerProperties properties) {
        this.restClientBuilder = restClientBuilder;
        this.objectMapper = objectMapper;
        this.responseReader = responseReader;
        this.properties = properties;
    }

    @Override
    public AgentDescriptor discover(String baseUrl) {
        if (!StringUtils.hasText(baseUrl)) {
            throw new AgentDiscoveryException("Agent base URL is not configured.");
        }
        String base = normalize(baseUrl);
        RestClient client = client(properties.getDiscoveryTimeout());
        String body;
        try {
            body = fetchCard(client, base + properties.getAgentCardPath());
        } catch (HttpClientErrorException.NotFound notFound) {
            log.info("No agent card at {}{}, trying {}.", base, properties.getAgentCardPath(),
                    properties.getLegacyAgentCardPath());
            body = fetchLegacyCard(client, base);
        } catch (RestClientException ex) {
            throw unreachable(base, ex);
        }
        AgentDescriptor descriptor = parseDescriptor(base, body);
        log.info("Discovered agent '{}' v{} at {} ({} skills).", descriptor.name(), descriptor.version(),
                descriptor.endpoint(), descriptor.skills().size());
        return descriptor;
    }

    @Override
    public TaskResponse send(AgentDescriptor descriptor, TaskRequest request, Duration timeout) {
        String endpoint = descriptor.endpoint();
        if (!StringUtils.hasText(endpoint)) {
            throw new AgentCallException("Agent '" + descriptor.name() + "' has no task endpoint.");
        }
        String body;
        try {
            body = client(timeout).post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(jsonRpcEnvelope(request))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException ex) {
            throw new AgentCallException("Agent '" + descriptor.name() + "' answered HTTP "
                    + ex.getStatusCode().value() + ".", ex);
        } catch (RestClientException ex) {
            if (isTimeout(ex)) {
                throw new AgentCallException("Call to '" + descriptor.name() + "' timed out after "
                        + timeout.toSeconds() + "s.", ex);
            }
            throw new AgentCallException("Call to '" + descriptor.name() + "' failed: " + ex.getMessage(), ex);
        }
        JsonNode reply = readReply(descriptor, body);
        JsonNode error = reply.path("error");
        if (error.isObject()) {
            throw new AgentCallException("Agent '" + descriptor.name() + "' returned error "
                    + error.path("code").asText("?") + ": " + error.path("message").asText("unknown error"));
        }
        return responseReader.read(request.id(), reply);
    }

    private String fetchCard(RestClient client, String url) {
        String body = client.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(String.class);
        if (!StringUtils.hasText(body)) {
            throw new AgentDiscoveryException("Agent card at " + url + " is empty.");
        }
        return body;
    }

    private String fetchLegacyCard(RestClient client, String base) {
        try {
            return fetchCard(client, base + properties.getLegacyAgentCardPath());
        } catch (RestClientResponseException ex) {
            if (ex.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                throw new AgentDiscoveryException("Agent at " + base + " publishes no agent card.", ex);
            }
            throw new AgentDiscoveryException("Agent at " + base + " answered HTTP "
                    + ex.getStatusCode().value() + " for its agent card.", ex);
        } catch (RestClientException ex) {
            throw unreachable(base, ex);
        }
    }

    private AgentDiscoveryException unreachable(String base, RestClientException ex) {
        if (isTimeout(ex)) {
            return new AgentDiscoveryException("Agent card at " + base + " timed out after "
                    + properties.getDiscoveryTimeout().toSeconds() + "s.", ex);
        }
        return new AgentDiscoveryException("Agent at " + base + " is unreachable: " + ex.getMessage(), ex);
    }

    private AgentDescriptor parseDescriptor(String base, String body) {
        AgentDescriptor descriptor;
        try {
            descriptor = objectMapper.readValue(body, AgentDescriptor.class);
        } catch (JsonProcessingException ex) {
            throw new AgentDiscoveryException("Agent card at " + base + " is not valid JSON.", ex);
        }
        if (descriptor == null || !StringUtils.hasText(descriptor.name())) {
            throw new AgentDiscoveryException("Agent card at " + base + " has no name.");
        }
        return descriptor.withBaseUrl(base);
    }

    private JsonNode readReply(AgentDescriptor descriptor, String body) {
        if (!StringUtils.hasText(body)) {
            throw new AgentCallException("Agent '" + descriptor.name() + "' sent an empty reply.");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new AgentCallException("Agent '" + descriptor.name() + "' sent a reply that is not JSON.", ex);
        }
    }

    private JsonRpcRequest jsonRpcEnvelope(TaskRequest request) {
        OutboundMessage message = new OutboundMessage(MESSAGE_KIND, request.role(), request.parts(), request.messageId());
        return new JsonRpcRequest(JSON_RPC_VERSION, request.id(), METHOD_MESSAGE_SEND, new MessageParams(message));
    }

    /**
     * Read timeouts surface either as a {@link ResourceAccessException} or, when the body is read
     * lazily, wrapped inside a plain {@link RestClientException}.
     */
    static boolean isTimeout(Throwable ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    private RestClient client(Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(readTimeout);
        return restClientBuilder.clone()
                .requestFactory(requestFactory)
                .build();
    }

    private static String normalize(String base) {
        String trimmed = base.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
