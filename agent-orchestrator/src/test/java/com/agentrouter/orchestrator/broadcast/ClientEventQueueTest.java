package com.agentrouter.orchestrator.broadcast;

import com.agentrouter.common.event.EventEnvelope;
import com.agentrouter.common.event.EventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClientEventQueueTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static EventEnvelope agent(String agentId, String status, long sequence) {
        return new EventEnvelope(EventType.AGENT_STATUS_UPDATE, "s-1", agentId, agentId, status,
                                 50.0, null, T0, sequence, null);
    }

    private static List<EventEnvelope> drain(ClientEventQueue queue) {
        List<EventEnvelope> out = new ArrayList<>();
        EventEnvelope next;
        while ((next = queue.poll()) != null) {
            out.add(next);
        }
        return out;
    }

    @Test
    @DisplayName("overflow drops the oldest progress update of the same agent first")
    void dropsSameStreamFirst() {
        ClientEventQueue queue = new ClientEventQueue(3);
        queue.offer(agent("billing", "analyzing", 1));
        queue.offer(agent("security", "analyzing", 1));
        queue.offer(agent("billing", "processing", 2));
        queue.offer(agent("billing", "completing", 3));

        List<EventEnvelope> left = drain(queue);
        assertEquals(3, left.size());
        assertEquals("security", left.get(0).agentId());
        assertEquals(2, left.get(1).sequence());
        assertEquals(3, left.get(2).sequence());
        assertEquals(1, queue.droppedCount());
    }

    @Test
    @DisplayName("overflow falls back to the oldest progress update of any agent")
    void dropsAnyStream() {
        ClientEventQueue queue = new ClientEventQueue(2);
        queue.offer(agent("billing", "analyzing", 1));
        queue.offer(agent("security", "analyzing", 1));
        queue.offer(agent("general", "analyzing", 1));

        List<EventEnvelope> left = drain(queue);
        assertEquals(List.of("security", "general"), left.stream().map(EventEnvelope::agentId).toList());
    }

    @Test
    @DisplayName("terminal events are never dropped")
    void keepsTerminal() {
        ClientEventQueue queue = new ClientEventQueue(2);
        queue.offer(agent("billing", "finished", 5));
        queue.offer(agent("security", "error", 3));
        queue.offer(agent("general", "processing", 2));
        queue.offer(agent("general", "finished", 6));

        List<EventEnvelope> left = drain(queue);
        assertEquals(3, left.size());
        assertTrue(left.stream().allMatch(EventEnvelope::isTerminal));
        assertEquals(1, queue.droppedCount());
    }

    @Test
    @DisplayName("rejects a non-positive capacity")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ClientEventQueue(0));
    }
}
