package com.bko.controltower.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class EventBroadcasterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EventBroadcaster broadcaster = new EventBroadcaster(objectMapper);

    @Test
    void deliversEachEventToEveryObserver() throws Exception {
        RecordingConnection first = new RecordingConnection("a");
        RecordingConnection second = new RecordingConnection("b");
        RecordingConnection third = new RecordingConnection("c");
        broadcaster.register(first);
        broadcaster.register(second);
        broadcaster.register(third);

        int delivered = broadcaster.publish(WorkflowEvent.of(WorkflowEventType.VISION_START, Map.of("message", "go")));

        assertEquals(3, delivered);
        for (RecordingConnection connection : List.of(first, second, third)) {
            assertEquals(1, connection.messages.size());
            JsonNode json = objectMapper.readTree(connection.messages.get(0));
            assertEquals("vision_start", json.path("type").asText());
            assertEquals("go", json.path("message").asText());
            assertTrue(json.path("timestamp").isNumber());
        }
    }

    @Test
    void failingObserverIsDroppedWithoutAffectingOthers() {
        RecordingConnection healthy = new RecordingConnection("healthy");
        RecordingConnection broken = new RecordingConnection("broken");
        broken.failSends = true;
        broadcaster.register(healthy);
        broadcaster.register(broken);

        int delivered = broadcaster.publish(WorkflowEvent.of(WorkflowEventType.DISCOVERY_START, Map.of("agent", "vision")));
        broadcaster.publish(WorkflowEvent.of(WorkflowEventType.DISCOVERY_COMPLETE, Map.of("agent", "vision")));

        assertEquals(1, delivered);
        assertEquals(2, healthy.messages.size());
        assertFalse(broadcaster.isRegistered(broken));
        assertTrue(broken.closed);
        assertEquals(1, broadcaster.observerCount());
    }

    @Test
    void closedObserverIsDroppedOnPublish() {
        RecordingConnection connection = new RecordingConnection("gone");
        broadcaster.register(connection);
        connection.open = false;

        assertEquals(0, broadcaster.publish(WorkflowEvent.of(WorkflowEventType.VISION_START, Map.of())));
        assertEquals(0, broadcaster.observerCount());
    }

    @Test
    void unregisterIsIdempotent() {
        RecordingConnection connection = new RecordingConnection("x");
        broadcaster.register(connection);

        broadcaster.unregister(connection);
        broadcaster.unregister(connection);

        assertEquals(0, broadcaster.observerCount());
        assertEquals(0, broadcaster.publish(WorkflowEvent.of(WorkflowEventType.VISION_START, Map.of())));
    }

    @Test
    void registeringDuringPublishIsSafe() {
        RecordingConnection late = new RecordingConnection("late");
        RecordingConnection registering = new RecordingConnection("registering") {
            @Override
            public void send(String message) throws IOException {
                super.send(message);
                broadcaster.register(late);
            }
        };
        broadcaster.register(registering);

        broadcaster.publish(WorkflowEvent.of(WorkflowEventType.VISION_START, Map.of()));
        broadcaster.publish(WorkflowEvent.of(WorkflowEventType.VISION_COMPLETE, Map.of()));

        assertTrue(broadcaster.isRegistered(late));
        assertFalse(late.messages.isEmpty());
        assertEquals(2, registering.messages.size());
    }

    @Test
    void shutdownClosesObserversAndRejectsNewOnes() {
        RecordingConnection existing = new RecordingConnection("existing");
        broadcaster.register(existing);

        broadcaster.shutdown();
        RecordingConnection after = new RecordingConnection("after");
        broadcaster.register(after);

        assertTrue(existing.closed);
        assertTrue(after.closed);
        assertEquals(0, broadcaster.observerCount());
    }

    static class RecordingConnection implements ObserverConnection {
        private final String id;
        final List<String> messages = new CopyOnWriteArrayList<>();
        volatile boolean open = true;
        volatile boolean closed;
        volatile boolean failSends;

        RecordingConnection(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void send(String message) throws IOException {
            if (failSends) {
                throw new IOException("broken pipe");
            }
            messages.add(message);
        }

        @Override
        public void close() {
            closed = true;
            open = false;
        }
    }
}
