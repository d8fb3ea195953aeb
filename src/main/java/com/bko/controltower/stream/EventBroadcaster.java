package com.bko.controltower.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans workflow events out to every registered observer. An observer whose delivery fails is
 * dropped during that publish; the others still receive the event. There is no replay buffer.
 */
@Component
public class EventBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final ObjectMapper objectMapper;
    private final Set<ObserverConnection> observers = ConcurrentHashMap.newKeySet();
    private volatile boolean shutdown;

    public EventBroadcaster(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void register(ObserverConnection connection) {
        if (shutdown) {
            connection.close();
            return;
        }
        if (observers.add(connection)) {
            log.info("Observer {} connected ({} active).", connection.id(), observers.size());
        }
    }

    public void unregister(ObserverConnection connection) {
        if (observers.remove(connection)) {
            log.info("Observer {} disconnected ({} active).", connection.id(), observers.size());
        }
    }

    /**
     * @return the number of observers the event was delivered to
     */
    public int publish(WorkflowEvent event) {
        String message;
        try {
            message = objectMapper.writeValueAsString(event.toWireMessage());
        } catch (JsonProcessingException ex) {
            log.warn("Dropping {} event that could not be serialized: {}", event.type().wireName(), ex.getMessage());
            return 0;
        }
        int delivered = 0;
        for (ObserverConnection connection : observers) {
            if (!connection.isOpen()) {
                drop(connection, "connection closed");
                continue;
            }
            try {
                connection.send(message);
                delivered++;
            } catch (IOException | RuntimeException ex) {
                drop(connection, ex.getMessage());
            }
        }
        return delivered;
    }

    public int observerCount() {
        return observers.size();
    }

    public boolean isRegistered(ObserverConnection connection) {
        return observers.contains(connection);
    }

    @PreDestroy
    public void shutdown() {
        shutdown = true;
        for (ObserverConnection connection : observers) {
            connection.close();
        }
        observers.clear();
        log.info("Event broadcaster shut down.");
    }

    private void drop(ObserverConnection connection, String reason) {
        if (observers.remove(connection)) {
            log.debug("Dropped observer {}: {}", connection.id(), reason);
        }
        try {
            connection.close();
        } catch (RuntimeException ex) {
            log.debug("Failed to close dropped observer {}: {}", connection.id(), ex.getMessage());
        }
    }
}
