package com.agentrouter.common.routing;

import com.agentrouter.common.model.Complexity;
import com.agentrouter.common.model.EscalationDecision;
import com.agentrouter.common.model.EscalationPriority;
import com.agentrouter.common.model.EscalationReason;
import com.agentrouter.common.model.QueryAnalysis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EscalationDeciderTest {

    private static QueryAnalysis analysis(Complexity complexity, int sentiment) {
        return new QueryAnalysis(List.of(), complexity, 0.0, sentiment);
    }

    @Test
    @DisplayName("calm, simple, narrow query does not escalate")
    void noEscalation() {
        EscalationDecision decision = EscalationDecider.decide(analysis(Complexity.MEDIUM, 0), 2);
        assertFalse(decision.escalate());
        assertTrue(decision.reasons().isEmpty());
        assertNull(decision.priority());
    }

    @Test
    @DisplayName("sentiment -1 escalates, sentiment 0 does not")
    void sentimentBoundary() {
        assertTrue(EscalationDecider.decide(analysis(Complexity.LOW, -1), 1).escalate());
        assertFalse(EscalationDecider.decide(analysis(Complexity.LOW, 0), 1).escalate());
    }

    @Test
    @DisplayName("three recommended agents escalate, two do not")
    void breadthBoundary() {
        EscalationDecision three = EscalationDecider.decide(analysis(Complexity.LOW, 0), 3);
        assertTrue(three.escalate());
        assertEquals(List.of(EscalationReason.BROAD_MATCH), three.reasons());
        assertEquals(EscalationPriority.MEDIUM, three.priority());

        assertFalse(EscalationDecider.decide(analysis(Complexity.LOW, 0), 2).escalate());
    }

    @Test
    @DisplayName("HIGH complexity escalates with HIGH priority")
    void highComplexity() {
        EscalationDecision decision = EscalationDecider.decide(analysis(Complexity.HIGH, 1), 0);
        assertEquals(List.of(EscalationReason.COMPLEX_ISSUE), decision.reasons());
        assertEquals(EscalationPriority.HIGH, decision.priority());
    }

    @Test
    @DisplayName("every matching condition is reported; priority is the highest")
    void allReasons() {
        EscalationDecision decision = EscalationDecider.decide(analysis(Complexity.HIGH, -3), 3);
        assertEquals(List.of(EscalationReason.COMPLEX_ISSUE, EscalationReason.NEGATIVE_SENTIMENT,
            EscalationReason.BROAD_MATCH), decision.reasons());
        assertEquals(EscalationPriority.HIGH, decision.priority());
    }
}
