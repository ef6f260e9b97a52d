package com.agentrouter.orchestrator.session;

import com.agentrouter.common.model.AgentProfile;
import com.agentrouter.common.model.AgentStatus;
import com.agentrouter.common.model.Query;
import com.agentrouter.common.model.RoutingDecision;
import com.agentrouter.common.model.SessionState;
import com.agentrouter.common.routing.JitterSource;
import com.agentrouter.common.routing.QueryRouter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationSessionTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static final List<AgentProfile> PROFILES = List.of(
        new AgentProfile("billing", "Billing Specialist", "Billing", List.of("billing", "refund"),
            List.of("billing disputes", "refund processing"), 0.35, 90.0),
        new AgentProfile("security", "Security Analyst", "Security", List.of("security", "breach"),
            List.of("incident response"), 0.4, 88.0));

    private static OrchestrationSession session(String text) {
        RoutingDecision decision = new QueryRouter(JitterSource.none(), null).route(text, PROFILES);
        return new OrchestrationSession(new Query(text, "s-1", T0, Map.of()), decision, T0);
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("slots follow the selected agents with their display names")
        void slots() {
            OrchestrationSession session = session("billing refund security breach");
            assertEquals(List.of("Billing Specialist", "Security Analyst"),
                session.slots().stream().map(AgentSlot::agentName).toList());
            assertEquals(SessionState.CREATED, session.state());
            assertEquals(0.0, session.overallProgress(), 1e-9);
        }

        @Test
        @DisplayName("skipping a phase is rejected")
        void invalidTransition() {
            OrchestrationSession session = session("billing refund");
            assertThrows(IllegalStateException.class, () -> session.transition(SessionState.COMPLETED));
            session.transition(SessionState.DISPATCHING);
            assertEquals(SessionState.DISPATCHING, session.state());
        }

        @Test
        @DisplayName("a settled slot ignores later writes")
        void frozenSlot() {
            OrchestrationSession session = session("billing refund");
            AgentSlot slot = session.slots().iterator().next();

            assertTrue(slot.fail("backend down", T0).isPresent());
            assertTrue(slot.advance(AgentStatus.FINISHED, 100, "late", T0).isEmpty());
            assertTrue(slot.fail("again", T0).isEmpty());
            assertEquals("backend down", slot.current().detail());
            assertTrue(slot.isSettled());
        }

        @Test
        @DisplayName("cancellation reaches late subscribers")
        void cancellation() {
            OrchestrationSession session = session("billing refund");
            session.cancel();
            StepVerifier.create(session.cancellation()).expectNext(true).verifyComplete();
        }
    }

    @Nested
    @DisplayName("views")
    class Views {

        @Test
        @DisplayName("execution log keeps only the newest entries")
        void boundedLog() {
            OrchestrationSession session = session("billing refund");
            for (int i = 0; i < OrchestrationSession.MAX_LOG_ENTRIES + 10; i++) {
                session.appendLog("test", "info", "entry " + i, T0);
            }
            List<ExecutionLogEntry> log = session.executionLog();
            assertEquals(OrchestrationSession.MAX_LOG_ENTRIES, log.size());
            assertEquals("entry 10", log.get(0).message());
        }

        @Test
        @DisplayName("completion estimate extrapolates elapsed time from progress")
        void estimate() {
            OrchestrationSession session = session("billing refund");
            AgentSlot slot = session.slots().iterator().next();
            slot.advance(AgentStatus.PROCESSING, 25, "working", T0.plusSeconds(10));

            SessionSnapshot snapshot = session.snapshot(T0.plusSeconds(10));

            assertEquals(25.0, snapshot.overallProgress(), 1e-9);
            assertEquals(T0.plusSeconds(40), snapshot.estimatedCompletion());
        }

        @Test
        @DisplayName("no estimate before any progress")
        void noEstimate() {
            assertNull(session("billing refund").snapshot(T0.plusSeconds(5)).estimatedCompletion());
        }
    }
}
