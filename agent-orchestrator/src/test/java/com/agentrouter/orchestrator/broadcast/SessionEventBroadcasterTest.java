package com.agentrouter.orchestrator.broadcast;

import com.agentrouter.client.SequenceTracker;
import com.agentrouter.common.event.EventEnvelope;
import com.agentrouter.common.event.SessionEvent;
import com.agentrouter.common.model.AgentRuntimeState;
import com.agentrouter.common.model.AgentStatus;
import com.agentrouter.common.model.SessionState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SessionEventBroadcasterTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final SessionEventBroadcaster broadcaster =
        new SessionEventBroadcaster(16, Clock.fixed(T0, ZoneOffset.UTC));

    private static SessionEvent.AgentStatusUpdate update(String sessionId, AgentRuntimeState state) {
        return new SessionEvent.AgentStatusUpdate(sessionId, state);
    }

    private static List<EventEnvelope> collect(ClientSubscription subscription) {
        List<EventEnvelope> seen = new CopyOnWriteArrayList<>();
        subscription.events().subscribe(seen::add);
        return seen;
    }

    @Nested
    @DisplayName("fan-out")
    class FanOut {

        @Test
        @DisplayName("unscoped clients receive every session")
        void unscoped() {
            List<EventEnvelope> seen = collect(broadcaster.subscribe("c-1"));

            broadcaster.publish(new SessionEvent.PhaseUpdate("s-1", SessionState.DISPATCHING, 0.0, T0, 1));
            broadcaster.publish(new SessionEvent.PhaseUpdate("s-2", SessionState.DISPATCHING, 0.0, T0, 1));

            assertEquals(2, seen.size());
        }

        @Test
        @DisplayName("focused clients receive only their sessions until they stop")
        void focused() {
            ClientSubscription subscription = broadcaster.subscribe("c-1");
            List<EventEnvelope> seen = collect(subscription);
            broadcaster.startStreaming(subscription, "s-1");

            broadcaster.publish(new SessionEvent.PhaseUpdate("s-1", SessionState.DISPATCHING, 0.0, T0, 1));
            broadcaster.publish(new SessionEvent.PhaseUpdate("s-2", SessionState.DISPATCHING, 0.0, T0, 1));
            broadcaster.stopStreaming(subscription, "s-1");
            broadcaster.publish(new SessionEvent.PhaseUpdate("s-1", SessionState.AGGREGATING, 50.0, T0, 2));

            assertEquals(1, seen.size());
            assertEquals("s-1", seen.get(0).sessionId());
        }

        @Test
        @DisplayName("events wait for downstream demand")
        void backpressure() {
            ClientSubscription subscription = broadcaster.subscribe("c-1");
            AgentRuntimeState state = AgentRuntimeState.idle("billing", "Billing", T0);

            StepVerifier.create(subscription.events(), 0)
                .then(() -> {
                    broadcaster.publish(update("s-1", state.advance(AgentStatus.ANALYZING, 10, "a", T0)));
                    broadcaster.publish(update("s-1", state.advance(AgentStatus.ANALYZING, 10, "a", T0)
                        .advance(AgentStatus.PROCESSING, 25, "p", T0)));
                })
                .then(() -> assertEquals(2, subscription.pending()))
                .thenRequest(1)
                .expectNextMatches(e -> "analyzing".equals(e.status()))
                .then(() -> assertEquals(1, subscription.pending()))
                .thenRequest(1)
                .expectNextMatches(e -> "processing".equals(e.status()))
                .then(() -> broadcaster.unsubscribe(subscription))
                .verifyComplete();
        }

        @Test
        @DisplayName("a second connection under the same id replaces the first")
        void replacesClient() {
            ClientSubscription first = broadcaster.subscribe("c-1");
            StepVerifier.create(first.events())
                .then(() -> broadcaster.subscribe("c-1"))
                .verifyComplete();
            assertEquals(1, broadcaster.clientCount());

            broadcaster.unsubscribe(first);
            assertEquals(1, broadcaster.clientCount());
        }
    }

    @Nested
    @DisplayName("replay")
    class Replay {

        @Test
        @DisplayName("starting a stream replays each agent's latest event")
        void replaysLatest() {
            AgentRuntimeState analyzing = AgentRuntimeState.idle("billing", "Billing", T0)
                .advance(AgentStatus.ANALYZING, 10, "a", T0);
            AgentRuntimeState finished = analyzing.advance(AgentStatus.PROCESSING, 25, "p", T0)
                .advance(AgentStatus.FINISHED, 100, "done", T0);
            broadcaster.publish(update("s-1", analyzing));
            broadcaster.publish(update("s-1", finished));
            broadcaster.publish(update("s-1", analyzing));

            ClientSubscription late = broadcaster.subscribe("late");
            List<EventEnvelope> seen = collect(late);
            broadcaster.startStreaming(late, "s-1");

            assertEquals(1, seen.size());
            assertEquals("finished", seen.get(0).status());
            assertTrue(seen.get(0).isTerminal());
        }

        @Test
        @DisplayName("reconnecting client sees the terminal event it missed exactly once")
        void reconnectDedupe() {
            SequenceTracker tracker = new SequenceTracker();
            AgentRuntimeState processing = AgentRuntimeState.idle("billing", "Billing", T0)
                .advance(AgentStatus.ANALYZING, 10, "a", T0)
                .advance(AgentStatus.PROCESSING, 25, "p", T0);

            ClientSubscription first = broadcaster.subscribe("c-1");
            List<EventEnvelope> before = collect(first);
            broadcaster.startStreaming(first, "s-1");
            broadcaster.publish(update("s-1", processing));
            before.forEach(tracker::accept);
            broadcaster.unsubscribe(first);

            broadcaster.publish(update("s-1", processing.advance(AgentStatus.FINISHED, 100, "done", T0)));

            ClientSubscription second = broadcaster.subscribe("c-1");
            List<EventEnvelope> after = collect(second);
            broadcaster.startStreaming(second, "s-1");
            broadcaster.publish(update("s-1", processing.advance(AgentStatus.FINISHED, 100, "done", T0)));

            List<EventEnvelope> delivered = after.stream().filter(tracker::accept).toList();
            assertEquals(1, delivered.size());
            assertEquals("finished", delivered.get(0).status());
            assertEquals(1, tracker.duplicatesDiscarded());
        }

        @Test
        @DisplayName("forgotten sessions have nothing to replay")
        void forget() {
            broadcaster.publish(new SessionEvent.PhaseUpdate("s-1", SessionState.DISPATCHING, 0.0, T0, 1));
            broadcaster.forget("s-1");
            assertTrue(broadcaster.replay("s-1").isEmpty());
        }
    }
}
