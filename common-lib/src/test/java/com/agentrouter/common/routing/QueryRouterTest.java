package com.agentrouter.common.routing;

import com.agentrouter.common.exception.AgentIndexException;
import com.agentrouter.common.exception.InvalidQueryException;
import com.agentrouter.common.fixture.TestProfiles;
import com.agentrouter.common.model.AgentScore;
import com.agentrouter.common.model.EscalationReason;
import com.agentrouter.common.model.RoutingDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end routing of a query against a fixed agent index.
 */
class QueryRouterTest {

    private final QueryRouter router = new QueryRouter(JitterSource.none(), "general");

    @Nested
    @DisplayName("routing scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("webhook SSL failure routes to the technical agent without escalation")
        void singleTechnicalMatch() {
            RoutingDecision decision = router.route(
                "My webhook is failing with SSL certificate verification errors",
                TestProfiles.standardIndex());

            AgentScore top = decision.topAgent();
            assertEquals("technical", top.agentId());
            assertEquals(List.of("webhook", "ssl", "certificate"), top.matchedKeywords());
            assertTrue(top.score() >= 45.0);
            assertTrue(top.wouldTrigger());
            assertEquals(List.of("technical"), decision.selectedAgentIds());
            assertFalse(decision.fallbackUsed());
            assertFalse(decision.escalation().escalate());
        }

        @Test
        @DisplayName("query with no matches falls back to a single agent without escalation")
        void noMatchFallsBack() {
            RoutingDecision decision = router.route("What time is it?", TestProfiles.standardIndex());

            assertTrue(decision.recommended().isEmpty());
            assertTrue(decision.fallbackUsed());
            assertEquals(List.of("technical"), decision.selectedAgentIds());
            assertFalse(decision.escalation().escalate());
        }

        @Test
        @DisplayName("webhook + billing + security cues recommend three agents and escalate")
        void broadMatchEscalates() {
            RoutingDecision decision = router.route(
                "webhook ssl billing invoice security vulnerability",
                TestProfiles.broadMatchIndex());

            assertEquals(3, decision.recommended().size());
            assertEquals(3, decision.selectedAgentIds().size());
            assertTrue(decision.selectedAgentIds().containsAll(List.of("technical", "billing", "security")));
            assertTrue(decision.escalation().escalate());
            assertEquals(List.of(EscalationReason.BROAD_MATCH), decision.escalation().reasons());
        }
    }

    @Nested
    @DisplayName("invariants")
    class InvariantTests {

        @ParameterizedTest
        @ValueSource(strings = {"hello", "refund my invoice please", "zzz", "security", "?"})
        @DisplayName("selection is never empty and scores stay within [0,100]")
        void neverEmpty(String text) {
            RoutingDecision decision = router.route(text, TestProfiles.standardIndex());
            assertFalse(decision.selectedAgentIds().isEmpty());
            for (AgentScore s : decision.scores()) {
                assertTrue(s.score() >= 0.0 && s.score() <= 100.0);
                assertEquals(s.score() > s.confidenceThreshold() * 100.0, s.wouldTrigger());
            }
        }

        @Test
        @DisplayName("random jitter never changes ranking or selection")
        void jitterIndependent() {
            QueryRouter noisy = new QueryRouter(JitterSource.random(new Random(42)), "general");
            String text = "webhook ssl billing invoice security vulnerability";

            RoutingDecision calm = router.route(text, TestProfiles.broadMatchIndex());
            for (int i = 0; i < 20; i++) {
                RoutingDecision jittered = noisy.route(text, TestProfiles.broadMatchIndex());
                assertEquals(calm.selectedAgentIds(), jittered.selectedAgentIds());
                assertEquals(calm.scores().stream().map(AgentScore::agentId).toList(),
                    jittered.scores().stream().map(AgentScore::agentId).toList());
            }
        }
    }

    @Nested
    @DisplayName("rejections")
    class RejectionTests {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t\n"})
        @DisplayName("blank text is rejected before scoring")
        void blankRejected(String text) {
            assertThrows(InvalidQueryException.class, () -> router.route(text, TestProfiles.standardIndex()));
        }

        @Test
        @DisplayName("null text is rejected")
        void nullRejected() {
            assertThrows(InvalidQueryException.class, () -> router.route(null, TestProfiles.standardIndex()));
        }

        @Test
        @DisplayName("empty index is an index failure")
        void emptyIndex() {
            assertThrows(AgentIndexException.class, () -> router.route("hello", List.of()));
        }
    }
}
