package com.bko.controltower.a2a;

import com.bko.controltower.config.ControlTowerProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class A2AAgentClientTest {

    private static final String CARD = "{\"name\":\"Vision Agent\",\"description\":\"Counts boxes\","
            + "\"version\":\"1.2.0\",\"url\":\"%s/\",\"capabilities\":{\"streaming\":false},"
            + "\"skills\":[{\"id\":\"count\",\"name\":\"Count\",\"tags\":[\"vision\"]}],\"extra\":true}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HttpServer server;
    private String baseUrl;
    private A2AAgentClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        ControlTowerProperties properties = new ControlTowerProperties();
        properties.setConnectTimeout(Duration.ofSeconds(2));
        properties.setDiscoveryTimeout(Duration.ofSeconds(2));
        client = new A2AAgentClient(RestClient.builder(), objectMapper, new TaskResponseReader(), properties);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void discoverReadsAgentCard() {
        respond("/.well-known/agent-card.json", 200, CARD.formatted(baseUrl));

        AgentDescriptor descriptor = client.discover(baseUrl + "/");

        assertEquals("Vision Agent", descriptor.name());
        assertEquals("1.2.0", descriptor.version());
        assertEquals(baseUrl, descriptor.baseUrl());
        assertEquals(baseUrl + "/", descriptor.endpoint());
        assertEquals(List.of("count"), descriptor.skills().stream().map(AgentSkill::id).toList());
    }

    @Test
    void discoverFallsBackToLegacyCardPath() {
        respond("/.well-known/agent.json", 200, "{\"name\":\"Supplier Agent\"}");

        AgentDescriptor descriptor = client.discover(baseUrl);

        assertEquals("Supplier Agent", descriptor.name());
        assertEquals(baseUrl, descriptor.endpoint());
        assertTrue(descriptor.skills().isEmpty());
    }

    @Test
    void discoverRejectsMalformedCard() {
        respond("/.well-known/agent-card.json", 200, "<html>not json</html>");

        AgentDiscoveryException ex = assertThrows(AgentDiscoveryException.class, () -> client.discover(baseUrl));
        assertTrue(ex.getMessage().contains("not valid JSON"));
    }

    @Test
    void discoverRejectsCardWithoutName() {
        respond("/.well-known/agent-card.json", 200, "{\"description\":\"anonymous\"}");

        assertThrows(AgentDiscoveryException.class, () -> client.discover(baseUrl));
    }

    @Test
    void discoverFailsWhenNoCardIsPublished() {
        AgentDiscoveryException ex = assertThrows(AgentDiscoveryException.class, () -> client.discover(baseUrl));
        assertTrue(ex.getMessage().contains("no agent card"));
    }

    @Test
    void discoverFailsWhenAgentIsUnreachable() {
        assertThrows(AgentDiscoveryException.class, () -> client.discover("http://127.0.0.1:1"));
    }

    @Test
    void sendPostsJsonRpcMessageAndReadsReply() throws Exception {
        AtomicReference<String> received = new AtomicReference<>();
        server.createContext("/tasks", exchange -> {
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            write(exchange, 200, "{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"result\":{\"kind\":\"message\","
                    + "\"parts\":[{\"kind\":\"text\",\"text\":\"12 boxes\"}]}}");
        });
        TaskRequest request = TaskRequest.fromUser(List.of(ContentPart.text("count the boxes")));

        TaskResponse response = client.send(descriptor(baseUrl + "/tasks"), request, Duration.ofSeconds(2));

        assertEquals("12 boxes", new ResponseNormalizer().normalize(response));
        JsonNode envelope = objectMapper.readTree(received.get());
        assertEquals("2.0", envelope.path("jsonrpc").asText());
        assertEquals("message/send", envelope.path("method").asText());
        assertEquals(request.id(), envelope.path("id").asText());
        JsonNode message = envelope.path("params").path("message");
        assertEquals("user", message.path("role").asText());
        assertEquals(request.messageId(), message.path("messageId").asText());
        assertEquals("text", message.path("parts").get(0).path("kind").asText());
        assertEquals("count the boxes", message.path("parts").get(0).path("text").asText());
    }

    @Test
    void sendTagsFilePartsWithKind() throws Exception {
        AtomicReference<String> received = new AtomicReference<>();
        server.createContext("/tasks", exchange -> {
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            write(exchange, 200, "{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"result\":{\"parts\":[{\"text\":\"ok\"}]}}");
        });
        TaskRequest request = TaskRequest.fromUser(List.of(
                ContentPart.file(new byte[]{1, 2, 3}, "image/jpeg"),
                ContentPart.text("count the boxes")));

        client.send(descriptor(baseUrl + "/tasks"), request, Duration.ofSeconds(2));

        JsonNode message = objectMapper.readTree(received.get()).path("params").path("message");
        assertEquals("message", message.path("kind").asText());
        JsonNode filePart = message.path("parts").get(0);
        assertEquals("file", filePart.path("kind").asText());
        assertEquals("AQID", filePart.path("file").path("bytes").asText());
        assertEquals("image/jpeg", filePart.path("file").path("mimeType").asText());
        JsonNode textPart = message.path("parts").get(1);
        assertEquals("text", textPart.path("kind").asText());
        assertEquals("count the boxes", textPart.path("text").asText());
    }

    @Test
    void sendSurfacesJsonRpcError() {
        respond("/tasks", 200, "{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"error\":{\"code\":-32600,\"message\":\"bad request\"}}");

        AgentCallException ex = assertThrows(AgentCallException.class, () -> client.send(descriptor(baseUrl + "/tasks"),
                TaskRequest.fromUser(List.of(ContentPart.text("q"))), Duration.ofSeconds(2)));
        assertTrue(ex.getMessage().contains("-32600"));
    }

    @Test
    void sendFailsOnHttpError() {
        respond("/tasks", 500, "{}");

        AgentCallException ex = assertThrows(AgentCallException.class, () -> client.send(descriptor(baseUrl + "/tasks"),
                TaskRequest.fromUser(List.of(ContentPart.text("q"))), Duration.ofSeconds(2)));
        assertTrue(ex.getMessage().contains("500"));
    }

    @Test
    void sendTimesOut() {
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(1500);
                write(exchange, 200, "{}");
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } catch (IOException ex) {
                exchange.close();
            }
        });

        AgentCallException ex = assertThrows(AgentCallException.class, () -> client.send(descriptor(baseUrl + "/slow"),
                TaskRequest.fromUser(List.of(ContentPart.text("q"))), Duration.ofMillis(300)));
        assertTrue(ex.getMessage().contains("timed out"), ex.getMessage());
    }

    @Test
    void discoverReportsSlowCardAsTimeout() {
        server.createContext("/.well-known/agent-card.json", exchange -> {
            try {
                Thread.sleep(1500);
                write(exchange, 200, "{\"name\":\"Late\"}");
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } catch (IOException ex) {
                exchange.close();
            }
        });
        ControlTowerProperties properties = new ControlTowerProperties();
        properties.setDiscoveryTimeout(Duration.ofMillis(300));
        A2AAgentClient impatient = new A2AAgentClient(RestClient.builder(), objectMapper, new TaskResponseReader(), properties);

        AgentDiscoveryException ex = assertThrows(AgentDiscoveryException.class, () -> impatient.discover(baseUrl));
        assertTrue(ex.getMessage().contains("timed out"), ex.getMessage());
    }

    @Test
    void timeoutIsFoundAnywhereInCauseChain() {
        RestClientException lazyRead = new RestClientException("Error while extracting response",
                new UncheckedIOException(new SocketTimeoutException("Read timed out")));

        assertTrue(A2AAgentClient.isTimeout(lazyRead));
        assertFalse(A2AAgentClient.isTimeout(new RestClientException("Connection refused")));
    }

    private AgentDescriptor descriptor(String url) {
        return new AgentDescriptor("Test Agent", null, baseUrl, url, "1.0", null, null, null, null);
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> write(exchange, status, body));
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
