package com.agentrouter.client;

import com.agentrouter.common.event.EventEnvelope;
import com.agentrouter.common.event.EventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SequenceTrackerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static EventEnvelope agent(String sessionId, String agentId, long sequence) {
        return new EventEnvelope(EventType.AGENT_STATUS_UPDATE, sessionId, agentId, agentId,
                                 "processing", 25.0, null, T0, sequence, null);
    }

    private final SequenceTracker tracker = new SequenceTracker();

    @Test
    @DisplayName("accepts increasing sequences and drops repeats")
    void dropsRepeats() {
        assertTrue(tracker.accept(agent("s-1", "technical", 1)));
        assertTrue(tracker.accept(agent("s-1", "technical", 2)));
        assertFalse(tracker.accept(agent("s-1", "technical", 2)));
        assertFalse(tracker.accept(agent("s-1", "technical", 1)));
        assertEquals(2, tracker.duplicatesDiscarded());
        assertEquals(2, tracker.lastSequence("s-1/technical"));
    }

    @Test
    @DisplayName("agents and sessions are tracked independently")
    void independentStreams() {
        assertTrue(tracker.accept(agent("s-1", "technical", 5)));
        assertTrue(tracker.accept(agent("s-1", "billing", 1)));
        assertTrue(tracker.accept(agent("s-2", "technical", 1)));

        EventEnvelope complete = new EventEnvelope(EventType.SESSION_COMPLETE, "s-1", null, null,
                                                   "completed", 100.0, null, T0, 3, null);
        assertTrue(tracker.accept(complete));
        assertFalse(tracker.accept(complete));
        assertEquals(1, tracker.duplicatesDiscarded());
    }
}
