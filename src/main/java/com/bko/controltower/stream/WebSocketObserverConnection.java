package com.bko.controltower.stream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Duration;

/**
 * Observer backed by a WebSocket session. Sends go through a
 * {@link ConcurrentWebSocketSessionDecorator}, so a client that stops reading overflows its
 * buffer or send time limit and fails instead of holding up the publisher.
 */
@Slf4j
public class WebSocketObserverConnection implements ObserverConnection {

    private final WebSocketSession session;

    public WebSocketObserverConnection(WebSocketSession session, Duration sendTimeLimit, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, (int) sendTimeLimit.toMillis(), bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String message) throws IOException {
        session.sendMessage(new TextMessage(message));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException ex) {
            log.debug("Failed to close observer {}: {}", id(), ex.getMessage());
        }
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof WebSocketObserverConnection that && id().equals(that.id());
    }

    @Override
    public int hashCode() {
        return id().hashCode();
    }
}
