package com.bko.controltower.stream;

import com.bko.controltower.config.ControlTowerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ObserverWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(ObserverWebSocketHandler.class);
    static final String PING = "ping";
    static final String PONG_MESSAGE = "{\"type\":\"" + WorkflowEventType.PONG.wireName() + "\"}";

    private final EventBroadcaster broadcaster;
    private final ControlTowerProperties properties;
    private final Map<String, ObserverConnection> connections = new ConcurrentHashMap<>();

    public ObserverWebSocketHandler(EventBroadcaster broadcaster, ControlTowerProperties properties) {
        this.broadcaster = broadcaster;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ControlTowerProperties.ObserverConfig config = properties.getObserver();
        ObserverConnection connection = new WebSocketObserverConnection(session,
                config.getSendTimeLimit(), config.getBufferSizeLimit());
        connections.put(session.getId(), connection);
        broadcaster.register(connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        if (!PING.equals(message.getPayload())) {
            return;
        }
        ObserverConnection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }
        try {
            connection.send(PONG_MESSAGE);
        } catch (IOException | RuntimeException ex) {
            log.debug("Failed to answer ping from {}: {}", session.getId(), ex.getMessage());
            broadcaster.unregister(connection);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on observer {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ObserverConnection connection = connections.remove(session.getId());
        if (connection != null) {
            broadcaster.unregister(connection);
        }
    }
}
