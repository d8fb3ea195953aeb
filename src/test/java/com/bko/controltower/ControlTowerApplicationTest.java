package com.bko.controltower;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.TestPropertySource;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {
        "controltower.vision.url=http://vision.test:9001",
        "controltower.supplier.url=http://supplier.test:9002"
})
class ControlTowerApplicationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void healthReportsConfiguredAgents() {
        @SuppressWarnings("unchecked")
        Map<String, Object> health = restTemplate.getForObject("/api/health", Map.class);

        assertEquals("healthy", health.get("status"));
        assertEquals("http://vision.test:9001", health.get("vision_url"));
        assertEquals("http://supplier.test:9002", health.get("supplier_url"));
    }

    @Test
    void observerChannelAnswersPing() throws Exception {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        StandardWebSocketClient client = new StandardWebSocketClient();
        WebSocketSession session = client.execute(new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                received.add(message.getPayload());
            }
        }, "ws://localhost:" + port + "/ws").get(5, TimeUnit.SECONDS);
        try {
            session.sendMessage(new TextMessage("ping"));
            assertEquals("{\"type\":\"pong\"}", received.poll(5, TimeUnit.SECONDS));
        } finally {
            session.close();
        }
    }
}
